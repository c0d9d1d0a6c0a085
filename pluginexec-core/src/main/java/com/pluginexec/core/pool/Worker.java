package com.pluginexec.core.pool;

import com.pluginexec.core.event.EngineEvents;
import com.pluginexec.core.event.EventBus;
import com.pluginexec.core.sandbox.SandboxedRuntime;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 工作进程（沙箱槽位）
 * <p>
 * 状态只能通过 CAS 迁移，保证同一时刻最多一个在途请求。
 */
@Slf4j
public class Worker {

    private final String id;
    private final SandboxedRuntime runtime;
    private final EventBus eventBus;

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.IDLE);
    private final AtomicInteger executions = new AtomicInteger();
    private volatile long lastUsedMillis;

    Worker(String id, SandboxedRuntime runtime, EventBus eventBus) {
        this.id = id;
        this.runtime = runtime;
        this.eventBus = eventBus;
        this.lastUsedMillis = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public WorkerState getState() {
        return state.get();
    }

    public int getExecutions() {
        return executions.get();
    }

    public long getLastUsedMillis() {
        return lastUsedMillis;
    }

    SandboxedRuntime getRuntime() {
        return runtime;
    }

    /**
     * CAS 迁移状态
     */
    boolean transition(WorkerState expected, WorkerState next) {
        if (!state.compareAndSet(expected, next)) {
            return false;
        }
        log.debug("[{}] {} -> {}", id, expected, next);
        if (eventBus != null) {
            eventBus.publish(new EngineEvents.WorkerStateEvent(id, expected, next));
        }
        return true;
    }

    /**
     * 关闭时强制终止，不论当前状态
     */
    void forceTerminate() {
        WorkerState previous = state.getAndSet(WorkerState.TERMINATED);
        if (previous != WorkerState.TERMINATED && eventBus != null) {
            eventBus.publish(new EngineEvents.WorkerStateEvent(id, previous, WorkerState.TERMINATED));
        }
    }

    int recordExecution() {
        this.lastUsedMillis = System.currentTimeMillis();
        return executions.incrementAndGet();
    }

    /**
     * 重启后计数清零
     */
    void resetExecutions() {
        executions.set(0);
    }

    @Override
    public String toString() {
        return String.format("Worker{id=%s, state=%s, executions=%d, generation=%d}",
                id, state.get(), executions.get(), runtime.getGeneration());
    }
}
