package com.pluginexec.core.sandbox;

import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.ThreadMXBean;

/**
 * 基于 ThreadMXBean / MemoryMXBean 的资源采样
 * <p>
 * 分配字节数依赖 HotSpot 扩展 {@code com.sun.management.ThreadMXBean}，是累计分配量而非驻留量；
 * 存活内存由 {@link LiveMemoryEstimator} 结合堆占用估算。
 */
@Slf4j
public class ThreadResourceMonitor implements ResourceMonitor {

    private static final ThreadResourceMonitor INSTANCE = new ThreadResourceMonitor();

    private final ThreadMXBean threadBean;
    private final MemoryMXBean memoryBean;
    private final com.sun.management.ThreadMXBean hotspotBean;

    private ThreadResourceMonitor() {
        this.threadBean = ManagementFactory.getThreadMXBean();
        this.memoryBean = ManagementFactory.getMemoryMXBean();
        com.sun.management.ThreadMXBean extended = null;
        if (threadBean instanceof com.sun.management.ThreadMXBean) {
            extended = (com.sun.management.ThreadMXBean) threadBean;
            if (extended.isThreadAllocatedMemorySupported() && !extended.isThreadAllocatedMemoryEnabled()) {
                extended.setThreadAllocatedMemoryEnabled(true);
            }
            if (!extended.isThreadAllocatedMemorySupported()) {
                extended = null;
            }
        }
        this.hotspotBean = extended;
        if (hotspotBean == null) {
            log.warn("Per-thread allocation sampling is not supported on this JVM, memory limits are not enforced");
        }
    }

    public static ThreadResourceMonitor getInstance() {
        return INSTANCE;
    }

    public boolean isAllocationSupported() {
        return hotspotBean != null;
    }

    @Override
    public long allocatedBytes(Thread thread) {
        if (hotspotBean == null || thread == null) {
            return -1;
        }
        return hotspotBean.getThreadAllocatedBytes(thread.getId());
    }

    @Override
    public long cpuTimeNanos(Thread thread) {
        if (thread == null || !threadBean.isThreadCpuTimeSupported()) {
            return -1;
        }
        return threadBean.getThreadCpuTime(thread.getId());
    }

    @Override
    public long heapUsedBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed();
    }

    @Override
    public long heapUsedAfterGc() {
        memoryBean.gc();
        return memoryBean.getHeapMemoryUsage().getUsed();
    }
}
