package com.pluginexec.api.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 执行结果（不可变，可缓存）
 */
@Value
@Builder(toBuilder = true)
public class ExecutionResult {

    ExecutionStatus status;

    Object output;

    long durationMs;

    /**
     * 观测到的内存峰值（字节），-1 表示平台不支持采样
     */
    long peakMemoryBytes;

    boolean cacheHit;

    @Singular
    List<String> logs;

    int retryCount;

    /**
     * 仅在非成功状态时存在
     */
    ExecutionError error;

    @Singular
    List<AttemptRecord> attempts;

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public ErrorKind errorKind() {
        return error != null ? error.getKind() : null;
    }

    public static ExecutionResult failure(ErrorKind kind, String message, long durationMs) {
        return ExecutionResult.builder()
                .status(kind == ErrorKind.TIMEOUT ? ExecutionStatus.TIMEOUT : ExecutionStatus.ERROR)
                .error(ExecutionError.of(kind, message))
                .durationMs(durationMs)
                .peakMemoryBytes(-1)
                .build();
    }
}
