package com.pluginexec.core.resilience;

/**
 * 熔断器接口
 */
public interface CircuitBreaker {

    /**
     * 是否允许请求通过（HALF_OPEN 下会占用一个试探名额）
     */
    boolean tryAcquirePermission();

    /**
     * 归还未实际执行的请求所占用的许可（如被背压拒绝）
     */
    void releasePermission();

    /**
     * 记录成功
     */
    void onSuccess();

    /**
     * 记录失败
     */
    void onError(Throwable throwable);

    /**
     * 获取当前状态
     */
    State getState();

    String getName();

    enum State {
        CLOSED, // 关闭（正常）
        OPEN, // 打开（熔断）
        HALF_OPEN // 半开（试探）
    }
}
