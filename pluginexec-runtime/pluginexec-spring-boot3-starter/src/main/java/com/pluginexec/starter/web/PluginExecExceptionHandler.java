package com.pluginexec.starter.web;

import com.pluginexec.api.exception.ExecutionRejectedException;
import com.pluginexec.api.exception.PluginExecException;
import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.starter.dto.ErrorResponseDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 准入拒绝 -> HTTP 状态码
 * <p>
 * 配额与熔断 429，队列满 503，无效请求 400，插件不存在 404。
 */
@Slf4j
@RestControllerAdvice
public class PluginExecExceptionHandler {

    @ExceptionHandler(ExecutionRejectedException.class)
    public ResponseEntity<ErrorResponseDTO> handleRejected(ExecutionRejectedException e) {
        log.debug("Execution rejected: kind={}, subject={}, message={}", e.getKind(), e.getSubject(), e.getMessage());
        return ResponseEntity.status(statusOf(e.getKind()))
                .body(ErrorResponseDTO.of(e.getKind(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDTO> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(PluginExecExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ErrorResponseDTO.of(ErrorKind.INVALID_REQUEST, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponseDTO.of(ErrorKind.INVALID_REQUEST, "Malformed request body"));
    }

    /**
     * 引擎未运行等非准入异常
     */
    @ExceptionHandler(PluginExecException.class)
    public ResponseEntity<ErrorResponseDTO> handleEngine(PluginExecException e) {
        log.error("Execution engine failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponseDTO("ENGINE_UNAVAILABLE", e.getMessage(), true));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case DAILY_LIMIT_EXCEEDED:
            case CONCURRENCY_LIMIT_EXCEEDED:
            case CIRCUIT_OPEN:
                return HttpStatus.TOO_MANY_REQUESTS;
            case QUEUE_FULL:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case PLUGIN_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
