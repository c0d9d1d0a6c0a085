package com.pluginexec.starter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pluginexec.api.model.AttemptRecord;
import com.pluginexec.api.model.ExecutionResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 执行结果响应
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResultDTO {

    private String taskId;

    /**
     * success / error / timeout
     */
    private String status;

    private Object output;

    private long durationMs;

    private long memoryUsedBytes;

    private boolean cacheHit;

    private List<String> logs;

    private int retryCount;

    private ErrorResponseDTO error;

    private List<Attempt> attempts;

    public static ExecutionResultDTO from(String taskId, ExecutionResult result) {
        return ExecutionResultDTO.builder()
                .taskId(taskId)
                .status(result.getStatus().wireName())
                .output(result.getOutput())
                .durationMs(result.getDurationMs())
                .memoryUsedBytes(result.getPeakMemoryBytes())
                .cacheHit(result.isCacheHit())
                .logs(result.getLogs())
                .retryCount(result.getRetryCount())
                .error(result.getError() != null
                        ? ErrorResponseDTO.of(result.getError().getKind(), result.getError().getMessage())
                        : null)
                .attempts(result.getAttempts().stream().map(Attempt::from).collect(Collectors.toList()))
                .build();
    }

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Attempt {
        private int attempt;
        private String status;
        private String errorKind;
        private long durationMs;
        private String workerId;

        static Attempt from(AttemptRecord record) {
            return Attempt.builder()
                    .attempt(record.getAttempt())
                    .status(record.getStatus().wireName())
                    .errorKind(record.getErrorKind() != null ? record.getErrorKind().name() : null)
                    .durationMs(record.getDurationMs())
                    .workerId(record.getWorkerId())
                    .build();
        }
    }
}
