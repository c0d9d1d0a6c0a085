package com.pluginexec.core.audit;

/**
 * 审计事件接收方（外部事件存储的适配点）
 */
@FunctionalInterface
public interface AuditEventSink {

    void deliver(AuditEvent event) throws Exception;
}
