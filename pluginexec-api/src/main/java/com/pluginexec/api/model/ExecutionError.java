package com.pluginexec.api.model;

import lombok.Value;

/**
 * 结构化错误：类型 + 可读信息 + 是否可重试
 */
@Value
public class ExecutionError {
    ErrorKind kind;
    String message;

    public static ExecutionError of(ErrorKind kind, String message) {
        return new ExecutionError(kind, message);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
