package com.pluginexec.starter.controller;

import com.pluginexec.api.exception.InvalidRequestException;
import com.pluginexec.api.model.ExecutionRequest;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.api.model.Priority;
import com.pluginexec.core.engine.ExecutionHandle;
import com.pluginexec.core.engine.PluginExecutionEngine;
import com.pluginexec.core.monitor.TraceContext;
import com.pluginexec.starter.dto.ErrorResponseDTO;
import com.pluginexec.starter.dto.ExecuteRequestDTO;
import com.pluginexec.starter.dto.ExecutionResultDTO;
import com.pluginexec.starter.dto.TaskAcceptedDTO;
import com.pluginexec.starter.service.ExecutionTaskStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * 执行入口
 * <p>
 * 同步请求阻塞到最终结果（含重试）；异步请求立即返回 taskId。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ExecutionController {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String ACTOR_HEADER = "X-Actor-Id";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private final PluginExecutionEngine engine;

    private final ExecutionTaskStore taskStore;

    @PostMapping("/execute")
    public ResponseEntity<?> execute(@Valid @RequestBody ExecuteRequestDTO dto,
                                     @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                     @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
                                     @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        ExecutionRequest request = toRequest(dto, tenantId, actorId);
        TraceContext.setTraceId(traceId);
        try {
            ExecutionHandle handle = engine.submit(request);
            if (dto.isAsync()) {
                taskStore.put(handle);
                TaskAcceptedDTO accepted = TaskAcceptedDTO.pending(handle.getExecutionId());
                return ResponseEntity.accepted().location(URI.create(accepted.getLocation())).body(accepted);
            }
            ExecutionResult result = handle.await();
            return ResponseEntity.ok(ExecutionResultDTO.from(handle.getExecutionId(), result));
        } finally {
            TraceContext.clear();
        }
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<?> getTask(@PathVariable String taskId) {
        Optional<ExecutionHandle> handle = taskStore.find(taskId);
        if (handle.isEmpty()) {
            return taskNotFound(taskId);
        }
        if (!handle.get().isDone()) {
            return ResponseEntity.accepted().body(TaskAcceptedDTO.pending(taskId));
        }
        return ResponseEntity.ok(ExecutionResultDTO.from(taskId, handle.get().await()));
    }

    /**
     * 取消（幂等）：已完成的任务保持原结果
     */
    @DeleteMapping("/tasks/{taskId}")
    public ResponseEntity<?> cancelTask(@PathVariable String taskId) {
        Optional<ExecutionHandle> handle = taskStore.find(taskId);
        if (handle.isEmpty()) {
            return taskNotFound(taskId);
        }
        boolean triggered = handle.get().cancel();
        if (triggered) {
            log.info("Task {} cancellation requested", taskId);
        }
        String status = handle.get().isDone() ? "completed" : "cancelling";
        return ResponseEntity.accepted().body(new TaskAcceptedDTO(taskId, status, "/tasks/" + taskId));
    }

    private ResponseEntity<ErrorResponseDTO> taskNotFound(String taskId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponseDTO("TASK_NOT_FOUND", "Task not found: " + taskId, false));
    }

    private ExecutionRequest toRequest(ExecuteRequestDTO dto, String tenantHeader, String actorHeader) {
        Priority priority;
        try {
            priority = Priority.parse(dto.getPriority());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("priority", "Unknown priority: " + dto.getPriority());
        }
        return ExecutionRequest.builder()
                .pluginId(dto.getPluginId())
                .actionName(dto.getActionName())
                .params(dto.getParams() != null ? dto.getParams() : Map.of())
                .secrets(dto.getSecrets() != null ? dto.getSecrets() : Map.of())
                .timeoutMs(dto.getTimeoutMs() != null ? dto.getTimeoutMs() : 0)
                .priority(priority)
                .tenantId(firstNonBlank(tenantHeader, dto.getTenantId()))
                .actorId(firstNonBlank(actorHeader, dto.getActorId()))
                .cacheable(dto.isCacheable())
                .build();
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }
}
