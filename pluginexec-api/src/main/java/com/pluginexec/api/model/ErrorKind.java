package com.pluginexec.api.model;

/**
 * 错误分类
 * <p>
 * retryable: 面向调用方，表示"稍后重试可能成功"；
 * autoRetryable: 面向引擎，表示引擎可自动退避重试。
 */
public enum ErrorKind {

    RESOURCE_EXCEEDED(false, false),
    TIMEOUT(true, true),
    EXECUTION_ERROR(false, false),
    CRASHED_PROCESS(true, true),
    NETWORK_ERROR(true, true),
    QUEUE_FULL(true, false),
    DAILY_LIMIT_EXCEEDED(true, false),
    CONCURRENCY_LIMIT_EXCEEDED(true, false),
    CIRCUIT_OPEN(true, false),
    NETWORK_ACCESS_DENIED(false, false),
    PLUGIN_NOT_FOUND(false, false),
    INVALID_REQUEST(false, false),
    CANCELLED(false, false);

    private final boolean retryable;
    private final boolean autoRetryable;

    ErrorKind(boolean retryable, boolean autoRetryable) {
        this.retryable = retryable;
        this.autoRetryable = autoRetryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isAutoRetryable() {
        return autoRetryable;
    }

    /**
     * 对外展示名称，如 DAILY_LIMIT_EXCEEDED -> DailyLimitExceeded
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
