package com.pluginexec.api.model;

import lombok.Value;

/**
 * 单次尝试记录
 */
@Value
public class AttemptRecord {
    int attempt;
    ExecutionStatus status;
    ErrorKind errorKind;
    long durationMs;
    String workerId;
}
