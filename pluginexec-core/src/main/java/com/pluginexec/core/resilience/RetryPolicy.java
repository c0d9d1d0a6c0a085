package com.pluginexec.core.resilience;

import com.pluginexec.api.model.ErrorKind;

/**
 * 重试策略
 */
public interface RetryPolicy {

    int maxAttempts();

    /**
     * 第 attempt 次尝试（从 1 开始）以 kind 失败后，是否再试
     */
    boolean shouldRetry(int attempt, ErrorKind kind);

    /**
     * 第 attempt 次尝试失败后，到下一次尝试之间的等待时间
     */
    long backoffMillis(int attempt);

    default RetryState initialState() {
        return RetryState.first(this);
    }
}
