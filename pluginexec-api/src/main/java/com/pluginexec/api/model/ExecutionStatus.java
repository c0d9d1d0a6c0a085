package com.pluginexec.api.model;

/**
 * 执行状态
 */
public enum ExecutionStatus {
    SUCCESS,
    ERROR,
    TIMEOUT;

    public String wireName() {
        return name().toLowerCase();
    }
}
