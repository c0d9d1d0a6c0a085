package com.pluginexec.api.model;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

/**
 * 执行请求（不可变）
 * <p>
 * secrets 只以引用名传入沙箱，永不出现在 toString 与日志中。
 */
@Value
@Builder(toBuilder = true)
public class ExecutionRequest {

    String pluginId;

    String actionName;

    @Singular
    Map<String, Object> params;

    @Singular
    @ToString.Exclude
    Map<String, String> secrets;

    /**
     * 请求超时，<=0 表示使用默认值
     */
    long timeoutMs;

    @Builder.Default
    Priority priority = Priority.NORMAL;

    String tenantId;

    /**
     * 发起调用的主体，为空时审计事件使用 tenantId
     */
    String actorId;

    /**
     * 调用方声明该动作是否为确定性、无副作用，可缓存
     */
    boolean cacheable;

    public String effectiveActorId() {
        return actorId != null && !actorId.isBlank() ? actorId : tenantId;
    }
}
