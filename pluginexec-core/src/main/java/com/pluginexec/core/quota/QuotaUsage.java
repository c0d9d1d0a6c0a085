package com.pluginexec.core.quota;

import lombok.Value;

import java.time.Instant;

/**
 * 配额使用快照（只读）
 */
@Value
public class QuotaUsage {
    String tenantId;
    QuotaTier tier;
    long used;
    long dailyLimit;
    int concurrent;
    int concurrencyLimit;
    Instant resetAt;

    /**
     * 剩余次数，-1 表示不限
     */
    public long remaining() {
        return dailyLimit < 0 ? -1 : Math.max(0, dailyLimit - used);
    }

    /**
     * 使用等级：ok / warning (>=80%) / critical (>=95%) / exceeded / unlimited
     */
    public String level() {
        if (dailyLimit < 0) {
            return "unlimited";
        }
        if (used >= dailyLimit) {
            return "exceeded";
        }
        double ratio = dailyLimit == 0 ? 1.0 : (double) used / dailyLimit;
        if (ratio >= 0.95) {
            return "critical";
        }
        if (ratio >= 0.80) {
            return "warning";
        }
        return "ok";
    }
}
