package com.pluginexec.core.event;

/**
 * 引擎内部事件标记接口
 */
public interface EngineEvent {

    long getTimestamp();
}
