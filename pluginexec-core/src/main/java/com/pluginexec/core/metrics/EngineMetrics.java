package com.pluginexec.core.metrics;

import com.pluginexec.core.cache.ResultCache;
import com.pluginexec.core.event.EngineEvents;
import com.pluginexec.core.event.EventBus;
import com.pluginexec.core.pool.PoolStats;
import com.pluginexec.core.pool.WorkerState;
import com.pluginexec.core.queue.RequestQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 引擎指标
 * <p>
 * 通过订阅 {@link EventBus} 事件更新计数器，队列、缓存与工作池以 Gauge 形式按需采样。
 */
public class EngineMetrics {

    public static final String PREFIX = "pluginexec";

    private final MeterRegistry registry;
    private final Timer queueWait;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter retries;

    public EngineMetrics(MeterRegistry registry, EventBus eventBus) {
        this.registry = registry;
        this.queueWait = Timer.builder(PREFIX + ".queue.wait")
                .description("Time requests spend waiting for a worker")
                .register(registry);
        this.cacheHits = registry.counter(PREFIX + ".cache.requests", "result", "hit");
        this.cacheMisses = registry.counter(PREFIX + ".cache.requests", "result", "miss");
        this.retries = registry.counter(PREFIX + ".retries");

        Gauge.builder(PREFIX + ".cache.hit.rate", this, EngineMetrics::cacheHitRate)
                .description("Share of cacheable lookups served from the result cache")
                .register(registry);

        eventBus.subscribe(EngineEvents.ExecutionCompletedEvent.class, this::onCompleted);
        eventBus.subscribe(EngineEvents.ExecutionRejectedEvent.class, this::onRejected);
        eventBus.subscribe(EngineEvents.CacheLookupEvent.class, this::onCacheLookup);
        eventBus.subscribe(EngineEvents.RetryScheduledEvent.class, e -> retries.increment());
        eventBus.subscribe(EngineEvents.CircuitBreakerStateEvent.class, this::onBreakerTransition);
    }

    /**
     * 注册采样型指标
     */
    public void bindGauges(ResultCache cache, RequestQueue queue, Supplier<PoolStats> pool) {
        Gauge.builder(PREFIX + ".cache.size", cache, ResultCache::size).register(registry);
        Gauge.builder(PREFIX + ".queue.depth", queue, RequestQueue::size).register(registry);
        for (WorkerState state : WorkerState.values()) {
            Gauge.builder(PREFIX + ".workers", pool, p -> p.get().count(state))
                    .tag("state", state.name().toLowerCase(Locale.ROOT))
                    .strongReference(true)
                    .register(registry);
        }
    }

    /**
     * 队列等待时间记录器（纳秒）
     */
    public LongConsumer queueWaitRecorder() {
        return nanos -> queueWait.record(nanos, TimeUnit.NANOSECONDS);
    }

    public double cacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        return total == 0 ? 0.0 : hits / total;
    }

    /**
     * 指标快照：{@code name{tag=value}} -> {statistic: value}
     */
    public Map<String, Map<String, Double>> snapshot() {
        Map<String, Map<String, Double>> result = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            Meter.Id id = meter.getId();
            if (!id.getName().startsWith(PREFIX + ".")) {
                continue;
            }
            Map<String, Double> values = new LinkedHashMap<>();
            for (Measurement m : meter.measure()) {
                values.put(m.getStatistic().getTagValueRepresentation().toLowerCase(Locale.ROOT), m.getValue());
            }
            result.put(key(id), values);
        }
        return result;
    }

    // ==================== 事件处理 ====================

    private void onCompleted(EngineEvents.ExecutionCompletedEvent event) {
        registry.counter(PREFIX + ".executions",
                "status", event.getStatus().wireName(),
                "cache_hit", String.valueOf(event.isCacheHit())).increment();
        Timer.builder(PREFIX + ".execution.duration")
                .tag("plugin", event.getPluginId())
                .register(registry)
                .record(event.getDurationMs(), TimeUnit.MILLISECONDS);
        if (event.getErrorKind() != null) {
            registry.counter(PREFIX + ".errors", "kind", event.getErrorKind().name()).increment();
        }
    }

    private void onRejected(EngineEvents.ExecutionRejectedEvent event) {
        registry.counter(PREFIX + ".rejections", "kind", event.getKind().name()).increment();
    }

    private void onCacheLookup(EngineEvents.CacheLookupEvent event) {
        if (event.isHit()) {
            cacheHits.increment();
        } else {
            cacheMisses.increment();
        }
    }

    private void onBreakerTransition(EngineEvents.CircuitBreakerStateEvent event) {
        registry.counter(PREFIX + ".breaker.transitions", "to", event.getNewState().name()).increment();
    }

    private static String key(Meter.Id id) {
        if (id.getTags().isEmpty()) {
            return id.getName();
        }
        return id.getName() + id.getTags().stream()
                .map(t -> t.getKey() + "=" + t.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }
}
