package com.pluginexec.core.audit;

import com.pluginexec.api.model.ExecutionRequest;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.core.quota.QuotaUsage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * 审计事件，投递到外部事件存储
 */
@Value
@Builder
public class AuditEvent {

    public static final String PLUGIN_ACTION_EXECUTED = "plugin_action_executed";

    String type;

    String actorId;

    /**
     * 目标实体，即插件ID
     */
    String targetId;

    Instant timestamp;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * 一次已准入执行（含缓存命中）的审计事件
     */
    public static AuditEvent pluginActionExecuted(ExecutionRequest request, ExecutionResult result,
                                                  QuotaUsage usage, Instant timestamp) {
        AuditEventBuilder builder = AuditEvent.builder()
                .type(PLUGIN_ACTION_EXECUTED)
                .actorId(request.effectiveActorId())
                .targetId(request.getPluginId())
                .timestamp(timestamp)
                .metadataEntry("pluginId", request.getPluginId())
                .metadataEntry("actionName", request.getActionName())
                .metadataEntry("executionTimeMs", result.getDurationMs())
                .metadataEntry("memoryUsedBytes", result.getPeakMemoryBytes())
                .metadataEntry("status", result.getStatus().wireName())
                .metadataEntry("cacheHit", result.isCacheHit());
        if (result.getError() != null) {
            builder.metadataEntry("errorType", result.getError().getKind().displayName());
        }
        if (result.getRetryCount() > 0) {
            builder.metadataEntry("retryCount", result.getRetryCount());
        }
        if (usage != null) {
            builder.metadataEntry("quotaUsed", usage.getUsed())
                    .metadataEntry("quotaRemaining", usage.remaining());
        }
        return builder.build();
    }
}
