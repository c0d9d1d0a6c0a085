package com.pluginexec.core.resilience;

import com.pluginexec.core.config.EngineConfig;
import com.pluginexec.core.event.EventBus;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 按插件维度持有熔断器，每个插件恰好一个
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private final EngineConfig config;
    private final LongSupplier clock;
    private final EventBus eventBus;

    public CircuitBreakerRegistry(EngineConfig config, LongSupplier clock, EventBus eventBus) {
        this.config = config;
        this.clock = clock != null ? clock : System::currentTimeMillis;
        this.eventBus = eventBus;
    }

    public CircuitBreaker forPlugin(String pluginId) {
        return breakers.computeIfAbsent(pluginId,
                k -> new ConsecutiveFailureCircuitBreaker(
                        k,
                        config.getFailureThreshold(),
                        config.getResetTimeoutMs(),
                        config.getHalfOpenMaxRequests(),
                        clock,
                        eventBus));
    }

    /**
     * 插件卸载时移除
     */
    public void remove(String pluginId) {
        breakers.remove(pluginId);
    }

    public Map<String, CircuitBreaker> snapshot() {
        return Collections.unmodifiableMap(breakers);
    }
}
