package com.pluginexec.core.audit;

import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.api.model.ExecutionRequest;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.api.model.ExecutionStatus;
import com.pluginexec.core.quota.QuotaTier;
import com.pluginexec.core.quota.QuotaUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("审计单元测试")
public class AuditManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static ExecutionRequest request() {
        return ExecutionRequest.builder()
                .pluginId("p1")
                .actionName("ping")
                .tenantId("t1")
                .secret("apiKey", "s3cr3t")
                .build();
    }

    @Test
    @DisplayName("成功事件携带执行元数据")
    void successEventShouldCarryMetadata() {
        ExecutionResult result = ExecutionResult.builder()
                .status(ExecutionStatus.SUCCESS)
                .durationMs(42)
                .peakMemoryBytes(1024)
                .build();
        QuotaUsage usage = new QuotaUsage("t1", QuotaTier.FREE, 10, 100, 0, 2, NOW);

        AuditEvent event = AuditEvent.pluginActionExecuted(request(), result, usage, NOW);

        assertEquals(AuditEvent.PLUGIN_ACTION_EXECUTED, event.getType());
        assertEquals("t1", event.getActorId());
        assertEquals("p1", event.getTargetId());
        assertEquals(NOW, event.getTimestamp());
        assertEquals("ping", event.getMetadata().get("actionName"));
        assertEquals(42L, event.getMetadata().get("executionTimeMs"));
        assertEquals(1024L, event.getMetadata().get("memoryUsedBytes"));
        assertEquals("success", event.getMetadata().get("status"));
        assertEquals(false, event.getMetadata().get("cacheHit"));
        assertEquals(90L, event.getMetadata().get("quotaRemaining"));
        assertFalse(event.getMetadata().containsKey("errorType"));
        assertFalse(event.toString().contains("s3cr3t"));
    }

    @Test
    @DisplayName("失败事件携带错误类型")
    void failureEventShouldCarryErrorType() {
        ExecutionResult result = ExecutionResult.failure(ErrorKind.TIMEOUT, "too slow", 200).toBuilder()
                .retryCount(2)
                .build();

        AuditEvent event = AuditEvent.pluginActionExecuted(request(), result, null, NOW);

        assertEquals("Timeout", event.getMetadata().get("errorType"));
        assertEquals("timeout", event.getMetadata().get("status"));
        assertEquals(2, event.getMetadata().get("retryCount"));
    }

    @Test
    @DisplayName("接收方失败只记录日志")
    void sinkFailureShouldNotPropagate() throws Exception {
        AuditManager manager = new AuditManager(event -> {
            throw new IllegalStateException("event store unavailable");
        }, Runnable::run);

        AuditEvent event = AuditEvent.builder().type("t").targetId("p1").build();

        assertDoesNotThrow(() -> manager.record(event).get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("事件投递到接收方")
    void eventShouldBeDelivered() throws Exception {
        List<AuditEvent> delivered = new ArrayList<>();
        AuditManager manager = new AuditManager(delivered::add, Runnable::run);
        AuditEvent event = AuditEvent.builder().type("t").targetId("p1").build();

        manager.record(event).get(1, TimeUnit.SECONDS);

        assertEquals(List.of(event), delivered);
    }

    @Test
    @DisplayName("未指定接收方时使用日志接收方")
    void nullSinkShouldFallBackToLogging() {
        AuditManager manager = new AuditManager(null, Runnable::run);

        assertDoesNotThrow(() -> manager.record(AuditEvent.builder().type("t").build()).join());
    }
}
