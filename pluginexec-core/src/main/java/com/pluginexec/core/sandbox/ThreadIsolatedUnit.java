package com.pluginexec.core.sandbox;

import com.pluginexec.core.spi.IsolatedUnit;
import com.pluginexec.core.spi.IsolatedUnitFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 线程级隔离单元：每个单元独占一个守护线程
 * <p>
 * kill 先中断线程并关闭执行器；宽限期内线程仍未退出时以 {@link Thread#stop()} 强制终止，
 * 单元随即作废。
 */
@Slf4j
public class ThreadIsolatedUnit implements IsolatedUnit {

    /**
     * 中断后等待线程自行退出的时间
     */
    static final long KILL_GRACE_MS = 200;

    private final String id;
    private final int generation;
    private final ResourceMonitor monitor;
    private final ThreadPoolExecutor executor;

    private volatile Thread thread;
    private volatile boolean killed;

    public ThreadIsolatedUnit(String workerId, int generation, ResourceMonitor monitor) {
        this.id = workerId;
        this.generation = generation;
        this.monitor = monitor;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "pluginexec-unit-" + workerId + "-g" + generation);
                    t.setDaemon(true);
                    this.thread = t;
                    return t;
                });
        this.executor.prestartCoreThread();
    }

    /**
     * 默认工厂
     */
    public static IsolatedUnitFactory factory() {
        ResourceMonitor monitor = ThreadResourceMonitor.getInstance();
        return (workerId, generation) -> new ThreadIsolatedUnit(workerId, generation, monitor);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public int getGeneration() {
        return generation;
    }

    @Override
    public <T> Future<T> run(Callable<T> task) {
        if (killed) {
            throw new IllegalStateException("Unit " + id + "-g" + generation + " has been killed");
        }
        return executor.submit(task);
    }

    @Override
    public long allocatedBytes() {
        return monitor.allocatedBytes(thread);
    }

    @Override
    public long cpuTimeNanos() {
        return monitor.cpuTimeNanos(thread);
    }

    @Override
    public void kill() {
        if (killed) {
            return;
        }
        killed = true;
        executor.shutdownNow();
        Thread t = thread;
        if (t != null && t != Thread.currentThread() && !awaitExit(t)) {
            forceStop(t);
        }
        log.debug("[{}] Unit generation {} killed", id, generation);
    }

    private boolean awaitExit(Thread t) {
        try {
            t.join(KILL_GRACE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }

    @SuppressWarnings("deprecation")
    private void forceStop(Thread t) {
        log.warn("[{}] Unit generation {} ignored interrupt for {}ms, stopping thread {}",
                id, generation, KILL_GRACE_MS, t.getName());
        try {
            t.stop();
        } catch (UnsupportedOperationException | SecurityException e) {
            log.error("[{}] Unable to stop thread {}: {}", id, t.getName(), e.toString());
        }
    }

    @Override
    public boolean isAlive() {
        Thread t = thread;
        return !killed && !executor.isShutdown() && t != null && t.isAlive();
    }
}
