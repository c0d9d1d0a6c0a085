package com.pluginexec.core.monitor;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 链路追踪上下文
 * 使用 ThreadLocal 管理 TraceId，并同步写入 MDC（traceId）。
 */
public class TraceContext {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private TraceContext() {
    }

    /**
     * 开启或获取当前 TraceId
     */
    public static String start() {
        String tid = TRACE_ID.get();
        if (tid == null) {
            tid = UUID.randomUUID().toString().replace("-", "");
            set(tid);
        }
        return tid;
    }

    public static String get() {
        return TRACE_ID.get();
    }

    /**
     * 允许手动设置 TraceId（用于从 Web Header 继承），为空时生成新的
     */
    public static void setTraceId(String traceId) {
        if (traceId != null && !traceId.isBlank()) {
            set(traceId);
        } else {
            start();
        }
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }

    private static void set(String traceId) {
        TRACE_ID.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }
}
