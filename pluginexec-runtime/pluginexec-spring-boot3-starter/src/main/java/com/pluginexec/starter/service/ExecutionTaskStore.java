package com.pluginexec.starter.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.pluginexec.core.engine.ExecutionHandle;

import java.time.Duration;
import java.util.Optional;

/**
 * 异步执行句柄存储
 * <p>
 * 条目在写入 retention 之后过期，查询方此后得到 404。
 */
public class ExecutionTaskStore {

    private final Cache<String, ExecutionHandle> handles;

    public ExecutionTaskStore(Duration retention, long maxSize) {
        this.handles = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maxSize)
                .build();
    }

    public void put(ExecutionHandle handle) {
        handles.put(handle.getExecutionId(), handle);
    }

    public Optional<ExecutionHandle> find(String taskId) {
        return Optional.ofNullable(handles.getIfPresent(taskId));
    }

    public long size() {
        return handles.estimatedSize();
    }
}
