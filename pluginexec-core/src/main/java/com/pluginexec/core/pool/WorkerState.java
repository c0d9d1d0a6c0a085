package com.pluginexec.core.pool;

/**
 * 工作进程状态
 * <p>
 * IDLE -> BUSY -> IDLE；BUSY -> RECYCLING -> TERMINATED；BUSY -> CRASHED -> IDLE（重启）
 */
public enum WorkerState {
    IDLE,
    BUSY,
    RECYCLING,
    TERMINATED,
    CRASHED
}
