package com.pluginexec.core.quota;

import lombok.Getter;

import java.time.Instant;

/**
 * 单租户配额记录
 * <p>
 * 只在 {@link QuotaEnforcer} 持有的 ConcurrentHashMap.compute 临界区内修改。
 */
@Getter
public class QuotaRecord {

    private final String tenantId;
    private QuotaTier tier;
    private long dailyLimit;
    private int concurrencyLimit;
    private long dailyCount;
    private int concurrent;
    private Instant resetAt;

    QuotaRecord(String tenantId, QuotaTier tier, QuotaTier.Limits limits, Instant resetAt) {
        this.tenantId = tenantId;
        this.resetAt = resetAt;
        applyTier(tier, limits);
    }

    void applyTier(QuotaTier tier, QuotaTier.Limits limits) {
        this.tier = tier;
        this.dailyLimit = limits.getDailyLimit();
        this.concurrencyLimit = limits.getConcurrencyLimit();
    }

    boolean dailyExhausted() {
        return dailyLimit >= 0 && dailyCount >= dailyLimit;
    }

    boolean concurrencyExhausted() {
        return concurrent >= concurrencyLimit;
    }

    void incrementDaily() {
        dailyCount++;
    }

    void refundDaily() {
        if (dailyCount > 0) {
            dailyCount--;
        }
    }

    void acquireSlot() {
        concurrent++;
    }

    void releaseSlot() {
        if (concurrent > 0) {
            concurrent--;
        }
    }

    boolean resetIfDue(Instant now, Instant nextResetAt) {
        if (now.isBefore(resetAt)) {
            return false;
        }
        dailyCount = 0;
        resetAt = nextResetAt;
        return true;
    }

    public long remaining() {
        return dailyLimit < 0 ? -1 : Math.max(0, dailyLimit - dailyCount);
    }

    QuotaUsage snapshot() {
        return new QuotaUsage(tenantId, tier, dailyCount, dailyLimit, concurrent, concurrencyLimit, resetAt);
    }
}
