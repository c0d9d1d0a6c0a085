package com.pluginexec.core.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginexec.api.exception.SandboxViolationException;
import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.api.model.ExecutionError;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.api.model.ExecutionStatus;
import com.pluginexec.api.plugin.PluginAction;
import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.core.sandbox.network.GuardedHttpClient;
import com.pluginexec.core.sandbox.network.NetworkGuard;
import com.pluginexec.core.spi.IsolatedUnit;
import com.pluginexec.core.spi.IsolatedUnitFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 沙箱运行时
 * <p>
 * 职责：在隔离单元内执行插件动作，并由调用线程（监督线程）负责
 * 超时、存活内存上限、取消的检测与强制终止。
 * <p>
 * 一个运行时同一时刻只执行一个动作，由所属 Worker 保证。
 */
@Slf4j
public class SandboxedRuntime {

    /**
     * 资源采样间隔
     */
    static final long SAMPLE_INTERVAL_MS = 50;

    /**
     * CPU 占用率只在运行足够久后才有参考意义
     */
    private static final long CPU_SAMPLE_MIN_WALL_NANOS = TimeUnit.MILLISECONDS.toNanos(200);

    private final String workerId;
    private final IsolatedUnitFactory unitFactory;
    private final NetworkGuard networkGuard;
    private final ObjectMapper objectMapper;
    private final ResourceMonitor resourceMonitor;

    private volatile IsolatedUnit unit;
    private int generation;

    public SandboxedRuntime(String workerId, IsolatedUnitFactory unitFactory,
                            NetworkGuard networkGuard, ObjectMapper objectMapper) {
        this(workerId, unitFactory, networkGuard, objectMapper, ThreadResourceMonitor.getInstance());
    }

    public SandboxedRuntime(String workerId, IsolatedUnitFactory unitFactory, NetworkGuard networkGuard,
                            ObjectMapper objectMapper, ResourceMonitor resourceMonitor) {
        this.workerId = workerId;
        this.unitFactory = unitFactory;
        this.networkGuard = networkGuard;
        this.objectMapper = objectMapper;
        this.resourceMonitor = resourceMonitor;
    }

    /**
     * 启动首个单元
     */
    public synchronized void start() {
        if (unit == null) {
            generation = 1;
            unit = unitFactory.spawn(workerId, generation);
        }
    }

    /**
     * 作废当前单元并以新代数重启
     */
    public synchronized void restart() {
        IsolatedUnit old = this.unit;
        if (old != null) {
            old.kill();
        }
        generation++;
        this.unit = unitFactory.spawn(workerId, generation);
        log.info("[{}] Sandbox unit restarted (generation {})", workerId, generation);
    }

    public synchronized void shutdown() {
        IsolatedUnit current = this.unit;
        if (current != null) {
            current.kill();
        }
    }

    public boolean isHealthy() {
        IsolatedUnit current = this.unit;
        return current != null && current.isAlive();
    }

    public synchronized int getGeneration() {
        return generation;
    }

    public String getWorkerId() {
        return workerId;
    }

    public ExecutionResult execute(PluginDescriptor plugin, String actionName, Map<String, Object> params,
                                   Map<String, String> secrets, SandboxLimits limits) {
        return execute(plugin, actionName, params, secrets, limits, new CancellationToken());
    }

    /**
     * 执行一次插件动作（单次尝试，不含重试）
     */
    public ExecutionResult execute(PluginDescriptor plugin, String actionName, Map<String, Object> params,
                                   Map<String, String> secrets, SandboxLimits limits,
                                   CancellationToken cancellation) {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(limits.getTimeoutMs());

        PluginAction action = plugin.action(actionName).orElse(null);
        if (action == null) {
            return ExecutionResult.failure(ErrorKind.PLUGIN_NOT_FOUND,
                    "Action not found: " + plugin.getId() + "#" + actionName, 0);
        }
        if (cancellation.isCancelled()) {
            return ExecutionResult.failure(ErrorKind.CANCELLED, "Execution cancelled before start", 0);
        }

        IsolatedUnit current = this.unit;
        if (current == null || !current.isAlive()) {
            return ExecutionResult.failure(ErrorKind.CRASHED_PROCESS, "Sandbox unit is not alive", 0);
        }

        SecretRedactor redactor = SecretRedactor.of(secrets != null ? secrets.values() : List.of());
        GuardedHttpClient http = new GuardedHttpClient(plugin.getId(), networkGuard, limits.getMaxNetworkBytes(),
                () -> Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000));
        DefaultSandboxContext context = new DefaultSandboxContext(plugin.getId(), actionName, secrets,
                redactor, http, deadlineNanos, cancellation);
        Map<String, Object> safeParams = params != null ? params : Map.of();

        LiveMemoryEstimator memory = new LiveMemoryEstimator(resourceMonitor, current::allocatedBytes,
                limits.getMaxMemoryBytes());
        long cpuBase = current.cpuTimeNanos();

        Future<Object> future;
        try {
            future = current.run(() -> action.execute(context, safeParams));
        } catch (RejectedExecutionException | IllegalStateException e) {
            return ExecutionResult.failure(ErrorKind.CRASHED_PROCESS, "Sandbox unit rejected the task", 0);
        }

        Outcome outcome = supervise(current, future, context, limits, memory, deadlineNanos, cancellation);

        long wallNanos = System.nanoTime() - startNanos;
        long peakMemory = outcome.peakMemoryBytes;
        reportCpu(current, context, limits, cpuBase, wallNanos, outcome.killed);

        ExecutionResult.ExecutionResultBuilder builder = ExecutionResult.builder()
                .durationMs(TimeUnit.NANOSECONDS.toMillis(wallNanos))
                .peakMemoryBytes(peakMemory);

        // 粘性违规优先于插件自身的返回
        SandboxViolationException violation = context.violation();
        ErrorKind kind = outcome.kind;
        String message = outcome.message;
        if (violation != null && kind != ErrorKind.TIMEOUT && kind != ErrorKind.CANCELLED) {
            kind = violation.getKind();
            message = violation.getMessage();
        }

        if (kind == null) {
            try {
                JsonNode output = objectMapper.valueToTree(outcome.output);
                builder.status(ExecutionStatus.SUCCESS).output(output);
            } catch (IllegalArgumentException e) {
                kind = ErrorKind.EXECUTION_ERROR;
                message = "Plugin output is not serializable: " + e.getMessage();
            }
        }
        if (kind != null) {
            builder.status(kind == ErrorKind.TIMEOUT ? ExecutionStatus.TIMEOUT : ExecutionStatus.ERROR)
                    .error(ExecutionError.of(kind, redactor.redact(message)));
            log.debug("[{}] {}#{} failed with {}: {}", workerId, plugin.getId(), actionName, kind,
                    redactor.redact(message));
        }
        return builder.logs(context.snapshotLogs()).build();
    }

    /**
     * 监督循环：按采样间隔等待结果，期间检查截止时间、内存与取消
     */
    private Outcome supervise(IsolatedUnit current, Future<Object> future, DefaultSandboxContext context,
                              SandboxLimits limits, LiveMemoryEstimator memory, long deadlineNanos,
                              CancellationToken cancellation) {
        while (true) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            long wait = Math.max(1, Math.min(SAMPLE_INTERVAL_MS, remainingMs));
            try {
                Object output = future.get(wait, TimeUnit.MILLISECONDS);
                return Outcome.success(output, memory.getPeakBytes());
            } catch (TimeoutException e) {
                if (memory.sample()) {
                    kill(current, future, context);
                    return Outcome.killed(ErrorKind.RESOURCE_EXCEEDED,
                            "Memory limit exceeded: live " + memory.getPeakBytes() + " bytes, limit "
                                    + limits.getMaxMemoryBytes(), memory.getPeakBytes());
                }
                long peakMemory = memory.getPeakBytes();
                if (cancellation.isCancelled()) {
                    kill(current, future, context);
                    return Outcome.killed(ErrorKind.CANCELLED, "Execution cancelled", peakMemory);
                }
                if (System.nanoTime() >= deadlineNanos) {
                    kill(current, future, context);
                    log.warn("[{}] {}#{} timed out after {}ms, unit killed", workerId,
                            context.getPluginId(), context.getActionName(), limits.getTimeoutMs());
                    return Outcome.killed(ErrorKind.TIMEOUT,
                            "Execution exceeded timeout of " + limits.getTimeoutMs() + "ms", peakMemory);
                }
            } catch (ExecutionException e) {
                return classify(current, e.getCause(), memory.getPeakBytes());
            } catch (CancellationException e) {
                return Outcome.killed(ErrorKind.CANCELLED, "Execution cancelled", memory.getPeakBytes());
            } catch (InterruptedException e) {
                // 监督线程被中断（引擎关闭）
                Thread.currentThread().interrupt();
                kill(current, future, context);
                return Outcome.killed(ErrorKind.CANCELLED, "Supervisor interrupted", memory.getPeakBytes());
            }
        }
    }

    private Outcome classify(IsolatedUnit current, Throwable cause, long peakMemory) {
        if (cause instanceof Error) {
            // Error 逃逸视为单元崩溃，单元状态不可信，直接作废
            current.kill();
            log.error("[{}] Sandbox unit crashed: {}", workerId, cause.toString());
            return Outcome.failed(ErrorKind.CRASHED_PROCESS, "Sandbox unit crashed: " + cause, peakMemory);
        }
        SandboxViolationException violation = findViolation(cause);
        if (violation != null) {
            return Outcome.failed(violation.getKind(), violation.getMessage(), peakMemory);
        }
        String message = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : String.valueOf(cause);
        return Outcome.failed(ErrorKind.EXECUTION_ERROR, message, peakMemory);
    }

    private static SandboxViolationException findViolation(Throwable t) {
        Throwable cursor = t;
        int depth = 0;
        while (cursor != null && depth++ < 10) {
            if (cursor instanceof SandboxViolationException) {
                return (SandboxViolationException) cursor;
            }
            cursor = cursor.getCause();
        }
        return null;
    }

    private void kill(IsolatedUnit current, Future<Object> future, DefaultSandboxContext context) {
        context.terminate();
        future.cancel(true);
        current.kill();
    }

    private void reportCpu(IsolatedUnit current, DefaultSandboxContext context, SandboxLimits limits,
                           long cpuBase, long wallNanos, boolean killed) {
        if (killed || cpuBase < 0 || wallNanos < CPU_SAMPLE_MIN_WALL_NANOS) {
            return;
        }
        long cpuNow = current.cpuTimeNanos();
        if (cpuNow < 0) {
            return;
        }
        long percent = (cpuNow - cpuBase) * 100 / wallNanos;
        if (percent > limits.getMaxCpuPercent()) {
            log.warn("[{}] {}#{} CPU usage {}% exceeded limit {}%", workerId,
                    context.getPluginId(), context.getActionName(), percent, limits.getMaxCpuPercent());
            context.systemLog("CPU usage " + percent + "% exceeded limit " + limits.getMaxCpuPercent() + "%");
        }
    }

    /**
     * 监督循环的结论
     */
    private static final class Outcome {
        final Object output;
        final ErrorKind kind;
        final String message;
        final long peakMemoryBytes;
        final boolean killed;

        private Outcome(Object output, ErrorKind kind, String message, long peakMemoryBytes, boolean killed) {
            this.output = output;
            this.kind = kind;
            this.message = message;
            this.peakMemoryBytes = peakMemoryBytes;
            this.killed = killed;
        }

        static Outcome success(Object output, long peak) {
            return new Outcome(output, null, null, peak, false);
        }

        static Outcome failed(ErrorKind kind, String message, long peak) {
            return new Outcome(null, kind, message, peak, false);
        }

        static Outcome killed(ErrorKind kind, String message, long peak) {
            return new Outcome(null, kind, message, peak, true);
        }
    }
}
