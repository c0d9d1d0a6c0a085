package com.pluginexec.starter.dto;

import com.pluginexec.core.engine.HealthSnapshot;
import com.pluginexec.core.pool.PoolStats;
import com.pluginexec.core.pool.WorkerState;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * GET /health 响应
 */
@Data
@Builder
public class HealthDTO {

    private String status;

    private boolean workersAvailable;

    private boolean cacheResponsive;

    private boolean resourcePressure;

    private double heapUsedRatio;

    private int queueDepth;

    private Pool pool;

    public static HealthDTO from(HealthSnapshot snapshot) {
        PoolStats stats = snapshot.getPool();
        Map<String, Integer> workers = new LinkedHashMap<>();
        for (WorkerState state : WorkerState.values()) {
            workers.put(state.name().toLowerCase(Locale.ROOT), stats.count(state));
        }
        return HealthDTO.builder()
                .status(snapshot.getStatus())
                .workersAvailable(snapshot.isWorkersAvailable())
                .cacheResponsive(snapshot.isCacheResponsive())
                .resourcePressure(snapshot.isResourcePressure())
                .heapUsedRatio(snapshot.getHeapUsedRatio())
                .queueDepth(snapshot.getQueueDepth())
                .pool(Pool.builder()
                        .total(stats.getTotal())
                        .minWorkers(stats.getMinWorkers())
                        .maxWorkers(stats.getMaxWorkers())
                        .availableSlots(stats.availableSlots())
                        .queueCapacity(stats.getQueueCapacity())
                        .workers(workers)
                        .build())
                .build();
    }

    @Data
    @Builder
    public static class Pool {
        private int total;
        private int minWorkers;
        private int maxWorkers;
        private int availableSlots;
        private int queueCapacity;
        private Map<String, Integer> workers;
    }
}
