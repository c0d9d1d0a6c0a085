package com.pluginexec.core.pool;

import lombok.Value;

import java.util.Map;

/**
 * 工作池快照
 */
@Value
public class PoolStats {
    int total;
    int minWorkers;
    int maxWorkers;
    Map<WorkerState, Integer> states;
    int queueDepth;
    int queueCapacity;

    public int count(WorkerState state) {
        return states.getOrDefault(state, 0);
    }

    /**
     * 可立即接收的执行数：空闲工作进程 + 尚可创建的工作进程
     */
    public int availableSlots() {
        int live = count(WorkerState.IDLE) + count(WorkerState.BUSY) + count(WorkerState.CRASHED);
        return count(WorkerState.IDLE) + Math.max(0, maxWorkers - live);
    }

    /**
     * 是否还能接收新请求（直接执行或排队）
     */
    public boolean canAcceptWork() {
        return availableSlots() > 0 || queueDepth < queueCapacity;
    }
}
