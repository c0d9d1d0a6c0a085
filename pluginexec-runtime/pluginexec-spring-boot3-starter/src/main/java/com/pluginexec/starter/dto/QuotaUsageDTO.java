package com.pluginexec.starter.dto;

import com.pluginexec.core.quota.QuotaUsage;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * GET /quota/{tenantId} 响应
 */
@Data
@Builder
public class QuotaUsageDTO {

    private String tenantId;

    private String tier;

    private long used;

    /**
     * -1 表示不限
     */
    private long dailyLimit;

    private long remaining;

    private int concurrent;

    private int concurrencyLimit;

    private Instant resetAt;

    /**
     * ok / warning / critical / exceeded / unlimited
     */
    private String level;

    public static QuotaUsageDTO from(QuotaUsage usage) {
        return QuotaUsageDTO.builder()
                .tenantId(usage.getTenantId())
                .tier(usage.getTier().name())
                .used(usage.getUsed())
                .dailyLimit(usage.getDailyLimit())
                .remaining(usage.remaining())
                .concurrent(usage.getConcurrent())
                .concurrencyLimit(usage.getConcurrencyLimit())
                .resetAt(usage.getResetAt())
                .level(usage.level())
                .build();
    }
}
