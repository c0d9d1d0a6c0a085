package com.pluginexec.starter.config;

import com.pluginexec.core.config.EngineConfig;
import com.pluginexec.core.quota.QuotaTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行引擎配置属性
 * <p>
 * 提供 IDE 智能提示和启动时校验，启动时转换为核心层的 {@link EngineConfig}。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "pluginexec")
public class PluginExecProperties {

    /**
     * 是否启用执行引擎
     */
    private boolean enabled = true;

    @Valid
    private Pool pool = new Pool();

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Sandbox sandbox = new Sandbox();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Quota quota = new Quota();

    @Valid
    private Tasks tasks = new Tasks();

    @Data
    public static class Pool {

        @Min(0)
        private int minWorkers = 2;

        @Min(1)
        private int maxWorkers = 10;

        /**
         * 单个工作进程执行次数上限，达到后回收
         */
        @Min(1)
        private int maxExecutionsPerWorker = 100;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration workerIdleTimeout = Duration.ofSeconds(300);
    }

    @Data
    public static class Queue {

        /**
         * 0 表示不排队，无空闲进程时直接拒绝
         */
        @Min(0)
        private int capacity = 100;

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration maxWait = Duration.ofSeconds(30);
    }

    @Data
    public static class Cache {

        private boolean enabled = true;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration ttl = Duration.ofHours(1);

        @Min(1)
        private long maxSize = 10_000;
    }

    @Data
    public static class Sandbox {

        @Min(1)
        private long maxMemoryMb = 128;

        @Min(1)
        private int maxCpuPercent = 80;

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration defaultTimeout = Duration.ofSeconds(30);

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration maxTimeout = Duration.ofMinutes(5);

        /**
         * 出站域名白名单，支持 *.example.com
         */
        private List<String> allowedDomains = new ArrayList<>();

        /**
         * 每个插件每秒出站请求数
         */
        @DecimalMin("0.1")
        private double networkRateLimit = 10.0;

        @Min(0)
        private long maxNetworkBytes = 10L * 1024 * 1024;
    }

    @Data
    public static class CircuitBreaker {

        @Min(1)
        private int failureThreshold = 5;

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration resetTimeout = Duration.ofSeconds(60);

        @Min(1)
        private int halfOpenMaxRequests = 1;
    }

    @Data
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration initialDelay = Duration.ofSeconds(1);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration maxDelay = Duration.ofSeconds(10);
    }

    @Data
    public static class Quota {

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration sweepInterval = Duration.ofSeconds(60);

        /**
         * 日计数重置所在时区
         */
        @NotNull
        private ZoneId resetZone = ZoneOffset.UTC;

        /**
         * 未在 tenants 中声明的租户使用的套餐
         */
        @NotNull
        private QuotaTier defaultTier = QuotaTier.FREE;

        /**
         * 租户 -> 套餐
         */
        private Map<String, QuotaTier> tenants = new HashMap<>();

        /**
         * 套餐限额覆盖
         */
        private Map<QuotaTier, TierLimits> tiers = new EnumMap<>(QuotaTier.class);
    }

    @Data
    public static class TierLimits {

        /**
         * 每日次数上限，负数表示不限
         */
        private long dailyLimit = QuotaTier.Limits.UNLIMITED;

        @Min(1)
        private int concurrencyLimit = 1;
    }

    @Data
    public static class Tasks {

        /**
         * 异步任务结果保留时间
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration retention = Duration.ofHours(1);

        @Min(1)
        private long maxSize = 10_000;
    }

    /**
     * 转换为核心层配置
     */
    public EngineConfig toEngineConfig() {
        EngineConfig.EngineConfigBuilder builder = EngineConfig.builder()
                .minWorkers(pool.getMinWorkers())
                .maxWorkers(pool.getMaxWorkers())
                .maxExecutionsPerWorker(pool.getMaxExecutionsPerWorker())
                .workerIdleTimeoutMs(pool.getWorkerIdleTimeout().toMillis())
                .queueCapacity(queue.getCapacity())
                .maxQueueWaitMs(queue.getMaxWait().toMillis())
                .cacheEnabled(cache.isEnabled())
                .cacheTtlMs(cache.getTtl().toMillis())
                .cacheMaxSize(cache.getMaxSize())
                .maxMemoryMb(sandbox.getMaxMemoryMb())
                .maxCpuPercent(sandbox.getMaxCpuPercent())
                .defaultTimeoutMs(sandbox.getDefaultTimeout().toMillis())
                .maxTimeoutMs(sandbox.getMaxTimeout().toMillis())
                .allowedDomains(sandbox.getAllowedDomains())
                .networkRateLimit(sandbox.getNetworkRateLimit())
                .maxNetworkBytes(sandbox.getMaxNetworkBytes())
                .failureThreshold(circuitBreaker.getFailureThreshold())
                .resetTimeoutMs(circuitBreaker.getResetTimeout().toMillis())
                .halfOpenMaxRequests(circuitBreaker.getHalfOpenMaxRequests())
                .retryMaxAttempts(retry.getMaxAttempts())
                .retryInitialDelayMs(retry.getInitialDelay().toMillis())
                .retryBackoffMultiplier(retry.getBackoffMultiplier())
                .retryMaxDelayMs(retry.getMaxDelay().toMillis())
                .quotaSweepIntervalMs(quota.getSweepInterval().toMillis())
                .quotaResetZone(quota.getResetZone());
        quota.getTiers().forEach((tier, limits) ->
                builder.tierLimit(tier, new QuotaTier.Limits(limits.getDailyLimit(), limits.getConcurrencyLimit())));
        return builder.build();
    }
}
