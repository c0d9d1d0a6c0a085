package com.pluginexec.core.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * 审计管理器 (异步非阻塞)
 * <p>
 * 接收方失败只记录日志，不影响执行结果。
 */
@Slf4j
public class AuditManager {

    private final AuditEventSink sink;
    private final Executor executor;

    public AuditManager(AuditEventSink sink) {
        this(sink, ForkJoinPool.commonPool());
    }

    public AuditManager(AuditEventSink sink, Executor executor) {
        this.sink = sink != null ? sink : new LoggingAuditEventSink();
        this.executor = executor;
    }

    public CompletableFuture<Void> record(AuditEvent event) {
        // 使用 CompletableFuture 异步执行，避免阻塞执行链路
        return CompletableFuture.runAsync(() -> {
            try {
                sink.deliver(event);
            } catch (Exception e) {
                log.warn("Audit delivery failed for {} on {}: {}", event.getType(), event.getTargetId(),
                        e.getMessage(), e);
            }
        }, executor);
    }
}
