package com.pluginexec.core.sandbox;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 单次执行的存活内存估算
 * <p>
 * 估算值取执行线程自开始以来的分配量与堆占用相对开始时增长量中的较小者：
 * 分配量是该线程存活对象的上界，堆增长则排除了已被回收的垃圾。
 * 估算值越过上限时请求一次完整回收，以回收后的堆增长复核，复核仍超限才判定超限。
 * 复核之间至少间隔 {@link #CONFIRM_INTERVAL_MS}。
 * <p>
 * 线程分配量不可采样时不做限制，峰值为 -1。
 */
public class LiveMemoryEstimator {

    static final long CONFIRM_INTERVAL_MS = 1_000;

    private final ResourceMonitor monitor;
    private final LongSupplier allocatedBytes;
    private final LongSupplier nanoClock;
    private final long limitBytes;
    private final long allocBase;
    private final long heapBase;

    private long peakBytes;
    private long nextConfirmNanos;

    public LiveMemoryEstimator(ResourceMonitor monitor, LongSupplier allocatedBytes, long limitBytes) {
        this(monitor, allocatedBytes, limitBytes, System::nanoTime);
    }

    LiveMemoryEstimator(ResourceMonitor monitor, LongSupplier allocatedBytes, long limitBytes,
                        LongSupplier nanoClock) {
        this.monitor = monitor;
        this.allocatedBytes = allocatedBytes;
        this.nanoClock = nanoClock;
        this.limitBytes = limitBytes;
        this.allocBase = allocatedBytes.getAsLong();
        this.heapBase = monitor.heapUsedBytes();
        this.peakBytes = allocBase >= 0 ? 0 : -1;
        this.nextConfirmNanos = nanoClock.getAsLong();
    }

    public boolean isSupported() {
        return allocBase >= 0;
    }

    /**
     * 采样一次
     *
     * @return 复核后确认超限时为 true
     */
    public boolean sample() {
        long allocated = allocatedSinceStart();
        if (allocated < 0) {
            return false;
        }
        long estimate = Math.min(allocated, growth(monitor.heapUsedBytes()));
        if (estimate <= limitBytes) {
            peakBytes = Math.max(peakBytes, estimate);
            return false;
        }
        long now = nanoClock.getAsLong();
        if (now - nextConfirmNanos < 0) {
            return false;
        }
        nextConfirmNanos = now + TimeUnit.MILLISECONDS.toNanos(CONFIRM_INTERVAL_MS);
        long live = Math.min(allocated, growth(monitor.heapUsedAfterGc()));
        peakBytes = Math.max(peakBytes, live);
        return live > limitBytes;
    }

    /**
     * 已确认的存活内存峰值，不支持采样时为 -1
     */
    public long getPeakBytes() {
        return peakBytes;
    }

    private long allocatedSinceStart() {
        if (allocBase < 0) {
            return -1;
        }
        long now = allocatedBytes.getAsLong();
        return now < 0 ? -1 : now - allocBase;
    }

    private long growth(long heapUsed) {
        return Math.max(0, heapUsed - heapBase);
    }
}
