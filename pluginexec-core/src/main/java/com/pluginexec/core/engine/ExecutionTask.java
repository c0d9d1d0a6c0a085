package com.pluginexec.core.engine;

import com.pluginexec.api.model.AttemptRecord;
import com.pluginexec.api.model.ExecutionRequest;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.core.cache.CacheKey;
import com.pluginexec.core.quota.QuotaReservation;
import com.pluginexec.core.queue.QueuedExecution;
import com.pluginexec.core.resilience.RetryState;
import com.pluginexec.core.sandbox.CancellationToken;
import com.pluginexec.core.sandbox.SandboxLimits;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次已准入执行在引擎内的状态（跨多次尝试）
 */
@Getter
class ExecutionTask {

    private final String executionId;
    private final String traceId;
    private final ExecutionRequest request;
    private final PluginDescriptor plugin;
    private final CacheKey cacheKey;
    private final QuotaReservation reservation;
    private final SandboxLimits limits;
    private final long startNanos;

    private final CancellationToken cancellation = new CancellationToken();
    private final CompletableFuture<ExecutionResult> future = new CompletableFuture<>();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final List<AttemptRecord> attempts = new ArrayList<>();

    private volatile RetryState retryState;
    private volatile QueuedExecution current;
    private ScheduledFuture<?> retryTimer; // guarded by this

    ExecutionTask(String executionId, String traceId, ExecutionRequest request, PluginDescriptor plugin,
                  CacheKey cacheKey, QuotaReservation reservation, SandboxLimits limits, RetryState initial) {
        this.executionId = executionId;
        this.traceId = traceId;
        this.request = request;
        this.plugin = plugin;
        this.cacheKey = cacheKey;
        this.reservation = reservation;
        this.limits = limits;
        this.retryState = initial;
        this.startNanos = System.nanoTime();
    }

    void setRetryState(RetryState retryState) {
        this.retryState = retryState;
    }

    void setCurrent(QueuedExecution current) {
        this.current = current;
    }

    synchronized void setRetryTimer(ScheduledFuture<?> retryTimer) {
        this.retryTimer = retryTimer;
    }

    /**
     * 撤销尚未触发的重试定时器
     *
     * @return 是否成功撤销
     */
    synchronized boolean cancelRetryTimer() {
        ScheduledFuture<?> timer = this.retryTimer;
        this.retryTimer = null;
        return timer != null && timer.cancel(false);
    }

    void recordAttempt(AttemptRecord record) {
        synchronized (attempts) {
            attempts.add(record);
        }
    }

    List<AttemptRecord> attemptsSnapshot() {
        synchronized (attempts) {
            return new ArrayList<>(attempts);
        }
    }

    boolean markFinished() {
        return finished.compareAndSet(false, true);
    }
}
