package com.pluginexec.core.spi;

/**
 * 隔离单元工厂
 */
@FunctionalInterface
public interface IsolatedUnitFactory {

    IsolatedUnit spawn(String workerId, int generation);
}
