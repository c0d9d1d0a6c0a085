package com.pluginexec.core.event;

import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.api.model.ExecutionStatus;
import com.pluginexec.core.pool.WorkerState;
import com.pluginexec.core.resilience.CircuitBreaker;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 引擎事件集合
 */
public final class EngineEvents {

    private EngineEvents() {
    }

    @Getter
    @RequiredArgsConstructor
    public static class CircuitBreakerStateEvent implements EngineEvent {
        private final String pluginId;
        private final CircuitBreaker.State oldState;
        private final CircuitBreaker.State newState;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class WorkerStateEvent implements EngineEvent {
        private final String workerId;
        private final WorkerState oldState;
        private final WorkerState newState;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class ExecutionCompletedEvent implements EngineEvent {
        private final String executionId;
        private final String pluginId;
        private final String actionName;
        private final ExecutionStatus status;
        private final ErrorKind errorKind;
        private final boolean cacheHit;
        private final int retryCount;
        private final long durationMs;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class ExecutionRejectedEvent implements EngineEvent {
        private final String pluginId;
        private final String tenantId;
        private final ErrorKind kind;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class CacheLookupEvent implements EngineEvent {
        private final String pluginId;
        private final boolean hit;
        private final long timestamp = System.currentTimeMillis();
    }

    @Getter
    @RequiredArgsConstructor
    public static class RetryScheduledEvent implements EngineEvent {
        private final String executionId;
        private final String pluginId;
        private final int attempt;
        private final long delayMs;
        private final ErrorKind cause;
        private final long timestamp = System.currentTimeMillis();
    }
}
