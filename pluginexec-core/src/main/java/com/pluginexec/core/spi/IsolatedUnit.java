package com.pluginexec.core.spi;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * 隔离执行单元 SPI
 * <p>
 * 一个单元同一时刻只运行一个任务；被 kill 之后不可复用，需由工厂重新 spawn。
 */
public interface IsolatedUnit {

    String getId();

    /**
     * 单元代数，同一个工作槽位每次重启 +1
     */
    int getGeneration();

    /**
     * 在单元内运行任务
     */
    <T> Future<T> run(Callable<T> task);

    /**
     * 单元执行线程累计分配字节数，不支持时返回 -1
     */
    long allocatedBytes();

    /**
     * 单元执行线程累计 CPU 时间（纳秒），不支持时返回 -1
     */
    long cpuTimeNanos();

    /**
     * 强制终止单元
     */
    void kill();

    boolean isAlive();
}
