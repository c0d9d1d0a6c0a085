package com.pluginexec.starter.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * POST /execute 请求体
 */
@Data
public class ExecuteRequestDTO {

    @NotBlank
    private String pluginId;

    @NotBlank
    private String actionName;

    private Map<String, Object> params = new HashMap<>();

    private Map<String, String> secrets = new HashMap<>();

    /**
     * 为空或 0 时使用默认超时
     */
    @PositiveOrZero
    private Long timeoutMs;

    /**
     * high / normal / low
     */
    private String priority;

    private boolean cacheable;

    /**
     * true 时立即返回 taskId，结果通过 GET /tasks/{taskId} 查询
     */
    private boolean async;

    /**
     * 优先使用 X-Tenant-Id 请求头
     */
    private String tenantId;

    private String actorId;
}
