package com.pluginexec.api.plugin;

import java.util.Optional;

/**
 * 沙箱上下文
 * 插件在执行期间唯一可见的能力入口（零信任）
 */
public interface SandboxContext {

    /**
     * 当前插件ID
     */
    String getPluginId();

    /**
     * 当前动作名
     */
    String getActionName();

    /**
     * 按引用名读取密钥
     */
    Optional<String> secret(String name);

    /**
     * 写一条结构化日志，随结果返回（密钥会被脱敏）
     */
    void log(String message);

    /**
     * 受控的出站 HTTP 客户端（白名单 + 字节预算 + 限流）
     */
    SandboxHttpClient http();

    /**
     * 剩余执行时间（毫秒）
     */
    long remainingMillis();

    /**
     * 执行是否已被取消或超时，长循环应主动检查
     */
    boolean isCancelled();
}
