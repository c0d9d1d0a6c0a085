package com.pluginexec.core.resilience;

import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.core.config.EngineConfig;

/**
 * 指数退避：delay = min(initialDelay * multiplier^(attempt-1), maxDelay)
 * <p>
 * 只对 {@link ErrorKind#isAutoRetryable()} 的失败重试（超时、瞬时网络错误、单元崩溃）。
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long initialDelayMs, double multiplier, long maxDelayMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialDelayMs = Math.max(0, initialDelayMs);
        this.multiplier = Math.max(1.0, multiplier);
        this.maxDelayMs = Math.max(this.initialDelayMs, maxDelayMs);
    }

    public static ExponentialBackoffRetryPolicy from(EngineConfig config) {
        return new ExponentialBackoffRetryPolicy(
                config.getRetryMaxAttempts(),
                config.getRetryInitialDelayMs(),
                config.getRetryBackoffMultiplier(),
                config.getRetryMaxDelayMs());
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public boolean shouldRetry(int attempt, ErrorKind kind) {
        return kind != null && kind.isAutoRetryable() && attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxDelayMs);
    }
}
