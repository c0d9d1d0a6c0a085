package com.pluginexec.core.queue;

import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.api.model.Priority;
import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.core.sandbox.CancellationToken;
import com.pluginexec.core.sandbox.SandboxLimits;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次待执行的尝试（工作池与队列的工作单元）
 * <p>
 * 回调的 workerId 为 null 表示该尝试从未到达工作进程（排队超时、取消、关闭）。
 */
@Getter
public class QueuedExecution {

    private final String executionId;
    private final PluginDescriptor plugin;
    private final String actionName;
    private final Map<String, Object> params;
    private final Map<String, String> secrets;
    private final SandboxLimits limits;
    private final Priority priority;
    private final CancellationToken cancellation;
    private final Callback callback;

    private final AtomicBoolean completed = new AtomicBoolean(false);

    // 由队列在入队时设置
    private volatile long sequence;
    private volatile long enqueuedAtNanos;

    @Builder
    private QueuedExecution(String executionId, PluginDescriptor plugin, String actionName,
                            Map<String, Object> params, Map<String, String> secrets, SandboxLimits limits,
                            Priority priority, CancellationToken cancellation, Callback callback) {
        this.executionId = executionId;
        this.plugin = plugin;
        this.actionName = actionName;
        this.params = params;
        this.secrets = secrets;
        this.limits = limits;
        this.priority = priority != null ? priority : Priority.NORMAL;
        this.cancellation = cancellation != null ? cancellation : new CancellationToken();
        this.callback = callback;
    }

    void markEnqueued(long sequence, long nowNanos) {
        this.sequence = sequence;
        this.enqueuedAtNanos = nowNanos;
    }

    /**
     * 完成回调，只生效一次
     */
    public boolean complete(ExecutionResult result, String workerId) {
        if (!completed.compareAndSet(false, true)) {
            return false;
        }
        callback.onComplete(this, result, workerId);
        return true;
    }

    public boolean isCompleted() {
        return completed.get();
    }

    @FunctionalInterface
    public interface Callback {
        void onComplete(QueuedExecution execution, ExecutionResult result, String workerId);
    }
}
