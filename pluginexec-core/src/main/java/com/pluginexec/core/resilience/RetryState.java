package com.pluginexec.core.resilience;

import com.pluginexec.api.model.ErrorKind;
import lombok.Value;

/**
 * 重试状态机的一个状态：(attempt, delayMs, remainingAttempts)
 * <p>
 * 由调度器定时驱动，不阻塞线程。
 */
@Value
public class RetryState {

    /**
     * 当前（即将进行或正在进行）的尝试序号，从 1 开始
     */
    int attempt;

    /**
     * 进入本次尝试前需要等待的时间
     */
    long delayMs;

    int remainingAttempts;

    static RetryState first(RetryPolicy policy) {
        return new RetryState(1, 0, policy.maxAttempts() - 1);
    }

    /**
     * 本次尝试以 kind 失败后的下一个状态；不可重试时返回 null
     */
    public RetryState next(RetryPolicy policy, ErrorKind kind) {
        if (remainingAttempts <= 0 || !policy.shouldRetry(attempt, kind)) {
            return null;
        }
        return new RetryState(attempt + 1, policy.backoffMillis(attempt), remainingAttempts - 1);
    }

    public int retryCount() {
        return attempt - 1;
    }
}
