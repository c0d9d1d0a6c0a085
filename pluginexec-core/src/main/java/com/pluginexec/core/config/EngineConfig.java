package com.pluginexec.core.config;

import com.pluginexec.core.quota.QuotaTier;
import com.pluginexec.core.sandbox.SandboxLimits;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * 执行引擎运行时配置
 */
@Getter
@Builder(toBuilder = true)
public class EngineConfig {

    // ==================== 工作进程池 ====================

    @Builder.Default
    private int minWorkers = 2;

    @Builder.Default
    private int maxWorkers = 10;

    /**
     * 单个工作进程执行次数上限，达到后回收（防止内存泄漏累积）
     */
    @Builder.Default
    private int maxExecutionsPerWorker = 100;

    @Builder.Default
    private long workerIdleTimeoutMs = 300_000;

    // ==================== 请求队列 ====================

    @Builder.Default
    private int queueCapacity = 100;

    @Builder.Default
    private long maxQueueWaitMs = 30_000;

    // ==================== 结果缓存 ====================

    @Builder.Default
    private boolean cacheEnabled = true;

    @Builder.Default
    private long cacheTtlMs = 3_600_000;

    @Builder.Default
    private long cacheMaxSize = 10_000;

    // ==================== 资源限制 ====================

    @Builder.Default
    private long maxMemoryMb = 128;

    @Builder.Default
    private int maxCpuPercent = 80;

    @Builder.Default
    private long defaultTimeoutMs = 30_000;

    @Builder.Default
    private long maxTimeoutMs = 300_000;

    // ==================== 网络 ====================

    @Singular
    private List<String> allowedDomains;

    /**
     * 每个插件每秒出站请求数
     */
    @Builder.Default
    private double networkRateLimit = 10.0;

    /**
     * 单次执行出站响应字节预算
     */
    @Builder.Default
    private long maxNetworkBytes = 10L * 1024 * 1024;

    // ==================== 熔断 ====================

    @Builder.Default
    private int failureThreshold = 5;

    @Builder.Default
    private long resetTimeoutMs = 60_000;

    @Builder.Default
    private int halfOpenMaxRequests = 1;

    // ==================== 重试 ====================

    @Builder.Default
    private int retryMaxAttempts = 3;

    @Builder.Default
    private long retryInitialDelayMs = 1_000;

    @Builder.Default
    private double retryBackoffMultiplier = 2.0;

    @Builder.Default
    private long retryMaxDelayMs = 10_000;

    // ==================== 配额 ====================

    @Builder.Default
    private long quotaSweepIntervalMs = 60_000;

    @Builder.Default
    private ZoneId quotaResetZone = ZoneOffset.UTC;

    /**
     * 套餐限额覆盖，未配置的套餐使用 {@link QuotaTier} 内置值
     */
    @Singular
    private Map<QuotaTier, QuotaTier.Limits> tierLimits;

    // ==================== 工厂方法 ====================

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    /**
     * 开发模式配置（更宽松）
     */
    public static EngineConfig development() {
        return EngineConfig.builder()
                .minWorkers(1)
                .defaultTimeoutMs(120_000)
                .maxTimeoutMs(600_000)
                .failureThreshold(20)
                .cacheTtlMs(60_000)
                .build();
    }

    public SandboxLimits sandboxLimits() {
        return SandboxLimits.builder()
                .maxMemoryBytes(maxMemoryMb * 1024 * 1024)
                .maxCpuPercent(maxCpuPercent)
                .timeoutMs(defaultTimeoutMs)
                .allowedDomains(allowedDomains)
                .networkRateLimit(networkRateLimit)
                .maxNetworkBytes(maxNetworkBytes)
                .build();
    }

    public QuotaTier.Limits limitsFor(QuotaTier tier) {
        QuotaTier.Limits override = tierLimits.get(tier);
        return override != null ? override : tier.defaultLimits();
    }

    /**
     * 将请求超时规整到 [1, maxTimeoutMs]，未指定时取默认值
     */
    public long effectiveTimeoutMs(long requestedMs) {
        long timeout = requestedMs > 0 ? requestedMs : defaultTimeoutMs;
        return Math.min(timeout, maxTimeoutMs);
    }

    public void validate() {
        if (minWorkers < 0 || maxWorkers < 1 || minWorkers > maxWorkers) {
            throw new IllegalArgumentException(
                    "Invalid worker bounds: min=" + minWorkers + ", max=" + maxWorkers);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must be >= 0");
        }
        if (defaultTimeoutMs <= 0 || maxTimeoutMs < defaultTimeoutMs) {
            throw new IllegalArgumentException(
                    "Invalid timeouts: default=" + defaultTimeoutMs + ", max=" + maxTimeoutMs);
        }
        if (halfOpenMaxRequests < 1 || failureThreshold < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be >= 1");
        }
        if (retryMaxAttempts < 1) {
            throw new IllegalArgumentException("retryMaxAttempts must be >= 1");
        }
    }

    @Override
    public String toString() {
        return String.format(
                "EngineConfig{workers=%d..%d, queue=%d, cache=%s/%dms, timeout=%d/%dms, memory=%dMB}",
                minWorkers, maxWorkers, queueCapacity, cacheEnabled, cacheTtlMs,
                defaultTimeoutMs, maxTimeoutMs, maxMemoryMb);
    }
}
