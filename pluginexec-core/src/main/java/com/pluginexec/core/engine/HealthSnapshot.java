package com.pluginexec.core.engine;

import com.pluginexec.core.pool.PoolStats;
import lombok.Value;

/**
 * 健康快照
 */
@Value
public class HealthSnapshot {

    /**
     * 工作池能否接收新请求（空闲、可扩容或队列未满）
     */
    boolean workersAvailable;

    boolean cacheResponsive;

    /**
     * 堆使用率超过 90% 或队列深度达到容量的 90%
     */
    boolean resourcePressure;

    double heapUsedRatio;

    PoolStats pool;

    public boolean isHealthy() {
        return workersAvailable && cacheResponsive && !resourcePressure;
    }

    public String getStatus() {
        return isHealthy() ? "healthy" : "degraded";
    }

    public int getQueueDepth() {
        return pool.getQueueDepth();
    }
}
