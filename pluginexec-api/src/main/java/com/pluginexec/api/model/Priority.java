package com.pluginexec.api.model;

/**
 * 优先级：声明顺序即出队顺序
 */
public enum Priority {
    HIGH,
    NORMAL,
    LOW;

    public static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return Priority.valueOf(value.trim().toUpperCase());
    }
}
