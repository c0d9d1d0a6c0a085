package com.pluginexec.core.audit;

import lombok.extern.slf4j.Slf4j;

/**
 * 默认审计接收方：输出结构化日志
 */
@Slf4j
public class LoggingAuditEventSink implements AuditEventSink {

    @Override
    public void deliver(AuditEvent event) {
        log.info("[AUDIT] type={}, actor={}, target={}, timestamp={}, metadata={}",
                event.getType(), event.getActorId(), event.getTargetId(), event.getTimestamp(), event.getMetadata());
    }
}
