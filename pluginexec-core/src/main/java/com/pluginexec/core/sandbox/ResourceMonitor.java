package com.pluginexec.core.sandbox;

/**
 * 线程级与堆级资源采样
 */
public interface ResourceMonitor {

    /**
     * 线程累计分配字节数，不支持时返回 -1
     */
    long allocatedBytes(Thread thread);

    /**
     * 线程累计 CPU 时间（纳秒），不支持时返回 -1
     */
    long cpuTimeNanos(Thread thread);

    /**
     * 当前堆已用字节，包含尚未回收的垃圾
     */
    long heapUsedBytes();

    /**
     * 请求一次完整回收后的堆已用字节
     */
    long heapUsedAfterGc();
}
