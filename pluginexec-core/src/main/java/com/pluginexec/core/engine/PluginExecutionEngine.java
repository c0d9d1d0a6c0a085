package com.pluginexec.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginexec.api.exception.ExecutionRejectedException;
import com.pluginexec.api.exception.InvalidRequestException;
import com.pluginexec.api.exception.PluginExecException;
import com.pluginexec.api.exception.PluginNotFoundException;
import com.pluginexec.api.model.AttemptRecord;
import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.api.model.ExecutionRequest;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.core.audit.AuditEvent;
import com.pluginexec.core.audit.AuditEventSink;
import com.pluginexec.core.audit.AuditManager;
import com.pluginexec.core.cache.CacheKey;
import com.pluginexec.core.cache.CaffeineResultCache;
import com.pluginexec.core.cache.ResultCache;
import com.pluginexec.core.config.EngineConfig;
import com.pluginexec.core.event.EngineEvents;
import com.pluginexec.core.event.EventBus;
import com.pluginexec.core.metrics.EngineMetrics;
import com.pluginexec.core.monitor.TraceContext;
import com.pluginexec.core.pool.PoolStats;
import com.pluginexec.core.pool.WorkerPoolManager;
import com.pluginexec.core.queue.QueuedExecution;
import com.pluginexec.core.queue.RequestQueue;
import com.pluginexec.core.quota.QuotaDecision;
import com.pluginexec.core.quota.QuotaEnforcer;
import com.pluginexec.core.quota.QuotaOutcome;
import com.pluginexec.core.quota.QuotaUsage;
import com.pluginexec.core.quota.TenantTierResolver;
import com.pluginexec.core.resilience.CircuitBreaker;
import com.pluginexec.core.resilience.CircuitBreakerRegistry;
import com.pluginexec.core.resilience.ExponentialBackoffRetryPolicy;
import com.pluginexec.core.resilience.RetryPolicy;
import com.pluginexec.core.resilience.RetryState;
import com.pluginexec.core.sandbox.SandboxLimits;
import com.pluginexec.core.sandbox.ThreadIsolatedUnit;
import com.pluginexec.core.sandbox.network.NetworkGuard;
import com.pluginexec.core.spi.IsolatedUnitFactory;
import com.pluginexec.core.spi.PluginChangeListener;
import com.pluginexec.core.spi.PluginRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 插件执行引擎（编排器）
 * <p>
 * 准入链路：日配额预检 -> 结果缓存 -> 配额预留 -> 熔断 -> 工作池/队列 -> 沙箱。
 * 准入阶段的拒绝同步抛出 {@link ExecutionRejectedException}；准入之后的失败以带 error 的
 * {@link ExecutionResult} 交付。结果回流时依次更新熔断器、缓存、配额、指标并发出审计事件。
 */
@Slf4j
public class PluginExecutionEngine implements AutoCloseable {

    private static final double PRESSURE_RATIO = 0.9;

    private final EngineConfig config;
    private final PluginRegistry registry;
    private final QuotaEnforcer quota;
    private final ResultCache cache;
    private final CircuitBreakerRegistry breakers;
    private final RetryPolicy retryPolicy;
    private final RequestQueue queue;
    private final WorkerPoolManager pool;
    private final NetworkGuard networkGuard;
    private final AuditManager audit;
    private final EngineMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Builder
    public PluginExecutionEngine(EngineConfig config,
                                 PluginRegistry registry,
                                 TenantTierResolver tierResolver,
                                 AuditEventSink auditSink,
                                 MeterRegistry meterRegistry,
                                 IsolatedUnitFactory unitFactory,
                                 ResultCache cache,
                                 NetworkGuard networkGuard,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("PluginRegistry is required");
        }
        this.config = config != null ? config : EngineConfig.defaults();
        this.config.validate();
        this.registry = registry;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.eventBus = new EventBus();

        this.metrics = new EngineMetrics(meterRegistry != null ? meterRegistry : new SimpleMeterRegistry(), eventBus);
        this.quota = new QuotaEnforcer(this.config, tierResolver, this.clock);
        this.cache = cache != null ? cache : new CaffeineResultCache(this.config.getCacheMaxSize());
        this.breakers = new CircuitBreakerRegistry(this.config, this.clock::millis, eventBus);
        this.retryPolicy = ExponentialBackoffRetryPolicy.from(this.config);
        this.queue = new RequestQueue(this.config.getQueueCapacity(), metrics.queueWaitRecorder());
        this.networkGuard = networkGuard != null ? networkGuard : NetworkGuard.from(this.config.sandboxLimits());
        this.pool = new WorkerPoolManager(this.config,
                unitFactory != null ? unitFactory : ThreadIsolatedUnit.factory(),
                this.networkGuard,
                objectMapper != null ? objectMapper : new ObjectMapper(),
                queue,
                eventBus);
        this.audit = new AuditManager(auditSink);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pluginexec-scheduler");
            t.setDaemon(true);
            return t;
        });

        metrics.bindGauges(this.cache, queue, pool::stats);
        registry.addListener(new PluginChangeListener() {
            @Override
            public void onPluginUpdated(PluginDescriptor descriptor) {
                PluginExecutionEngine.this.cache.invalidatePlugin(descriptor.getId());
            }

            @Override
            public void onPluginRemoved(String pluginId) {
                PluginExecutionEngine.this.cache.invalidatePlugin(pluginId);
                breakers.remove(pluginId);
                PluginExecutionEngine.this.networkGuard.forgetPlugin(pluginId);
            }
        });
    }

    /**
     * 启动工作池与后台清理任务
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        pool.start();
        quota.startSweeper(scheduler);

        long queueSweep = Math.max(100, Math.min(1_000, config.getMaxQueueWaitMs() / 2));
        scheduler.scheduleWithFixedDelay(() -> runSafely("queue expiry", pool::expireQueued),
                queueSweep, queueSweep, TimeUnit.MILLISECONDS);

        long idleSweep = Math.max(100, Math.min(60_000, config.getWorkerIdleTimeoutMs() / 2));
        scheduler.scheduleWithFixedDelay(() -> runSafely("idle eviction", pool::evictIdle),
                idleSweep, idleSweep, TimeUnit.MILLISECONDS);

        log.info("Plugin execution engine started: {}", config);
    }

    /**
     * 提交执行
     *
     * @throws ExecutionRejectedException 准入阶段被拒绝（配额、熔断、背压、无效请求、插件不存在）
     */
    public ExecutionHandle submit(ExecutionRequest request) {
        if (!started.get() || closed.get()) {
            throw new PluginExecException("Engine is not running");
        }
        validate(request);
        PluginDescriptor plugin = registry.resolve(request.getPluginId())
                .orElseThrow(() -> new PluginNotFoundException(request.getPluginId()));
        if (plugin.action(request.getActionName()).isEmpty()) {
            throw new PluginNotFoundException(request.getPluginId(), request.getActionName());
        }

        boolean ownsTrace = TraceContext.get() == null;
        String traceId = TraceContext.start();
        try {
            return admit(request, plugin, traceId);
        } finally {
            if (ownsTrace) {
                TraceContext.clear();
            }
        }
    }

    /**
     * 同步执行，等待最终结果
     */
    public ExecutionResult execute(ExecutionRequest request) {
        return submit(request).await();
    }

    public QuotaUsage quotaUsage(String tenantId) {
        return quota.usage(tenantId);
    }

    public HealthSnapshot health() {
        PoolStats stats = pool.stats();
        boolean cacheResponsive = cache.isResponsive();

        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double heapRatio = max > 0 ? (double) heap.getUsed() / max : 0.0;
        boolean queuePressure = queue.capacity() > 0 && queue.size() >= queue.capacity() * PRESSURE_RATIO;
        boolean pressure = heapRatio > PRESSURE_RATIO || queuePressure;

        return new HealthSnapshot(stats.canAcceptWork(), cacheResponsive, pressure, heapRatio, stats);
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public CircuitBreaker.State breakerState(String pluginId) {
        return breakers.forPlugin(pluginId).getState();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        quota.stopSweeper();
        scheduler.shutdownNow();
        pool.shutdown();
        log.info("Plugin execution engine stopped");
    }

    // ==================== 准入 ====================

    private ExecutionHandle admit(ExecutionRequest request, PluginDescriptor plugin, String traceId) {
        String tenantId = request.getTenantId();
        String executionId = UUID.randomUUID().toString();

        if (quota.checkDaily(tenantId) == QuotaOutcome.DAILY_LIMIT_EXCEEDED) {
            throw reject(request, ErrorKind.DAILY_LIMIT_EXCEEDED, tenantId,
                    "Daily execution limit reached for tenant " + tenantId);
        }

        CacheKey cacheKey = null;
        if (request.isCacheable() && config.isCacheEnabled()) {
            try {
                cacheKey = CacheKey.of(plugin.getId(), request.getActionName(), request.getParams(),
                        plugin.getVersion());
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("params", e.getMessage());
            }
            Optional<ExecutionResult> hit = cache.get(cacheKey);
            eventBus.publish(new EngineEvents.CacheLookupEvent(plugin.getId(), hit.isPresent()));
            if (hit.isPresent()) {
                return serveFromCache(executionId, request, hit.get());
            }
        }

        QuotaDecision decision = quota.checkAndReserve(tenantId);
        if (!decision.isAdmitted()) {
            throw reject(request, decision.getOutcome().errorKind(), tenantId,
                    decision.getOutcome() == QuotaOutcome.DAILY_LIMIT_EXCEEDED
                            ? "Daily execution limit reached for tenant " + tenantId
                            : "Concurrency limit reached for tenant " + tenantId);
        }

        SandboxLimits limits = config.sandboxLimits().withTimeoutMs(config.effectiveTimeoutMs(request.getTimeoutMs()));
        ExecutionTask task = new ExecutionTask(executionId, traceId, request, plugin, cacheKey,
                decision.getReservation(), limits, retryPolicy.initialState());
        try {
            startAttempt(task, true);
        } catch (ExecutionRejectedException e) {
            task.getReservation().cancel();
            eventBus.publish(new EngineEvents.ExecutionRejectedEvent(plugin.getId(), tenantId, e.getKind()));
            throw e;
        }
        log.debug("[{}] Action '{}' admitted as {} (tenant={}, timeout={}ms)", plugin.getId(),
                request.getActionName(), executionId, tenantId, limits.getTimeoutMs());
        return new ExecutionHandle(executionId, task.getFuture(), () -> cancel(task));
    }

    private ExecutionHandle serveFromCache(String executionId, ExecutionRequest request, ExecutionResult cached) {
        QuotaDecision decision = quota.consumeDaily(request.getTenantId());
        if (!decision.isAdmitted()) {
            throw reject(request, ErrorKind.DAILY_LIMIT_EXCEEDED, request.getTenantId(),
                    "Daily execution limit reached for tenant " + request.getTenantId());
        }
        ExecutionResult result = cached.toBuilder()
                .cacheHit(true)
                .retryCount(0)
                .clearAttempts()
                .durationMs(0)
                .build();
        log.debug("[{}] Cache hit for action '{}'", request.getPluginId(), request.getActionName());
        eventBus.publish(new EngineEvents.ExecutionCompletedEvent(executionId, request.getPluginId(),
                request.getActionName(), result.getStatus(), null, true, 0, 0));
        audit.record(AuditEvent.pluginActionExecuted(request, result, decision.getUsage(), clock.instant()));
        return ExecutionHandle.completed(executionId, result);
    }

    private ExecutionRejectedException reject(ExecutionRequest request, ErrorKind kind, String subject,
                                              String message) {
        log.warn("[{}] Rejected action '{}': {} ({})", request.getPluginId(), request.getActionName(), kind, message);
        eventBus.publish(new EngineEvents.ExecutionRejectedEvent(request.getPluginId(), request.getTenantId(), kind));
        return new ExecutionRejectedException(kind, subject, message);
    }

    private void validate(ExecutionRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request", "Request must not be null");
        }
        if (isBlank(request.getPluginId())) {
            throw new InvalidRequestException("pluginId", "pluginId is required");
        }
        if (isBlank(request.getActionName())) {
            throw new InvalidRequestException("actionName", "actionName is required");
        }
        if (isBlank(request.getTenantId())) {
            throw new InvalidRequestException("tenantId", "tenantId is required");
        }
    }

    // ==================== 尝试与重试 ====================

    /**
     * 发起一次尝试；首次尝试的拒绝同步抛出，重试的拒绝以结果结束
     */
    private void startAttempt(ExecutionTask task, boolean first) {
        String pluginId = task.getPlugin().getId();
        if (task.getCancellation().isCancelled()) {
            finish(task, ExecutionResult.failure(ErrorKind.CANCELLED, "Execution cancelled", 0));
            return;
        }

        CircuitBreaker breaker = breakers.forPlugin(pluginId);
        if (!breaker.tryAcquirePermission()) {
            String message = "Circuit breaker is open for plugin " + pluginId;
            if (first) {
                throw new ExecutionRejectedException(ErrorKind.CIRCUIT_OPEN, pluginId, message);
            }
            log.warn("[{}] Retry of {} denied by circuit breaker", pluginId, task.getExecutionId());
            finish(task, ExecutionResult.failure(ErrorKind.CIRCUIT_OPEN, message, 0));
            return;
        }

        int attempt = task.getRetryState().getAttempt();
        QueuedExecution execution = QueuedExecution.builder()
                .executionId(task.getExecutionId())
                .plugin(task.getPlugin())
                .actionName(task.getRequest().getActionName())
                .params(task.getRequest().getParams())
                .secrets(task.getRequest().getSecrets())
                .limits(task.getLimits())
                .priority(task.getRequest().getPriority())
                .cancellation(task.getCancellation())
                .callback((e, result, workerId) -> onAttemptComplete(task, attempt, result, workerId))
                .build();
        task.setCurrent(execution);

        try {
            pool.submit(execution);
        } catch (ExecutionRejectedException e) {
            breaker.releasePermission();
            if (first) {
                throw e;
            }
            finish(task, ExecutionResult.failure(e.getKind(), e.getMessage(), 0));
            return;
        }

        // 提交期间被取消
        if (task.getCancellation().isCancelled()) {
            pool.cancelQueued(execution);
        }
    }

    private void onAttemptComplete(ExecutionTask task, int attempt, ExecutionResult result, String workerId) {
        // 取消路径下回调在调用方线程执行，结束后恢复调用方的 traceId
        String previous = TraceContext.get();
        TraceContext.setTraceId(task.getTraceId());
        try {
            handleAttempt(task, attempt, result, workerId);
        } finally {
            restoreTrace(previous);
        }
    }

    private void handleAttempt(ExecutionTask task, int attempt, ExecutionResult result, String workerId) {
        String pluginId = task.getPlugin().getId();
        CircuitBreaker breaker = breakers.forPlugin(pluginId);
        ErrorKind kind = result.errorKind();

        RetryState next = null;
        if (!result.isSuccess() && workerId != null && !task.getCancellation().isCancelled()) {
            next = task.getRetryState().next(retryPolicy, kind);
        }

        if (workerId == null || kind == ErrorKind.CANCELLED) {
            // 未实际执行或被调用方取消，不计入熔断统计
            breaker.releasePermission();
        } else if (result.isSuccess()) {
            breaker.onSuccess();
        } else if (next != null) {
            // 一个请求只在最终失败时计一次，中间尝试的失败不推进熔断计数
            breaker.releasePermission();
        } else {
            breaker.onError(new PluginExecException(kind + ": " + result.getError().getMessage()));
        }

        if (workerId != null) {
            task.recordAttempt(new AttemptRecord(attempt, result.getStatus(), kind, result.getDurationMs(), workerId));
        }

        if (next != null) {
            scheduleRetry(task, next, kind);
            return;
        }
        finish(task, result);
    }

    private void scheduleRetry(ExecutionTask task, RetryState next, ErrorKind cause) {
        String pluginId = task.getPlugin().getId();
        task.setRetryState(next);
        log.info("[{}] Attempt {} of {} failed with {}, retrying in {}ms", pluginId, next.getAttempt() - 1,
                task.getExecutionId(), cause, next.getDelayMs());
        eventBus.publish(new EngineEvents.RetryScheduledEvent(task.getExecutionId(), pluginId, next.getAttempt(),
                next.getDelayMs(), cause));

        task.setRetryTimer(scheduler.schedule(() -> runRetry(task), next.getDelayMs(), TimeUnit.MILLISECONDS));
        if (task.getCancellation().isCancelled() && task.cancelRetryTimer()) {
            finish(task, ExecutionResult.failure(ErrorKind.CANCELLED, "Execution cancelled", 0));
        }
    }

    private void runRetry(ExecutionTask task) {
        TraceContext.setTraceId(task.getTraceId());
        try {
            startAttempt(task, false);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to dispatch retry of {}", task.getPlugin().getId(), task.getExecutionId(), e);
            finish(task, ExecutionResult.failure(ErrorKind.CRASHED_PROCESS,
                    "Retry dispatch failed: " + e.getMessage(), 0));
        } finally {
            TraceContext.clear();
        }
    }

    private boolean cancel(ExecutionTask task) {
        if (!task.getCancellation().cancel()) {
            return false;
        }
        log.info("[{}] Cancelling {}", task.getPlugin().getId(), task.getExecutionId());
        if (task.cancelRetryTimer()) {
            finish(task, ExecutionResult.failure(ErrorKind.CANCELLED, "Execution cancelled", 0));
            return true;
        }
        QueuedExecution current = task.getCurrent();
        if (current != null) {
            // 排队中则直接移除；执行中由监督线程在下一个采样点终止
            pool.cancelQueued(current);
        }
        return true;
    }

    // ==================== 结束 ====================

    private void finish(ExecutionTask task, ExecutionResult attemptResult) {
        if (!task.markFinished()) {
            return;
        }
        ExecutionRequest request = task.getRequest();
        String pluginId = task.getPlugin().getId();
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - task.getStartNanos());
        List<AttemptRecord> attempts = task.attemptsSnapshot();

        ExecutionResult result = attemptResult.toBuilder()
                .cacheHit(false)
                .durationMs(durationMs)
                .retryCount(Math.max(0, attempts.size() - 1))
                .clearAttempts()
                .attempts(attempts)
                .build();

        try {
            if (result.isSuccess() && task.getCacheKey() != null) {
                cache.put(task.getCacheKey(), result, config.getCacheTtlMs());
            }
            task.getReservation().release();
            QuotaUsage usage = quota.usage(request.getTenantId());

            eventBus.publish(new EngineEvents.ExecutionCompletedEvent(task.getExecutionId(), pluginId,
                    request.getActionName(), result.getStatus(), result.errorKind(), false,
                    result.getRetryCount(), durationMs));
            audit.record(AuditEvent.pluginActionExecuted(request, result, usage, clock.instant()));

            log.info("[{}] Action '{}' finished: status={}, error={}, duration={}ms, retries={}", pluginId,
                    request.getActionName(), result.getStatus().wireName(), result.errorKind(), durationMs,
                    result.getRetryCount());
        } catch (RuntimeException e) {
            log.error("[{}] Post-execution bookkeeping failed for {}", pluginId, task.getExecutionId(), e);
            task.getReservation().release();
        } finally {
            task.getFuture().complete(result);
        }
    }

    private static void restoreTrace(String previous) {
        if (previous != null) {
            TraceContext.setTraceId(previous);
        } else {
            TraceContext.clear();
        }
    }

    private void runSafely(String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Background task '{}' failed", name, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
