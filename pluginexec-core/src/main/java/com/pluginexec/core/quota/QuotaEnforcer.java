package com.pluginexec.core.quota;

import com.pluginexec.core.config.EngineConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 租户配额执行器
 * <p>
 * 职责：
 * 1. 每日执行次数与并发数的原子准入（检查 + 自增在同一个 compute 临界区内完成）
 * 2. 并发槽位的恰好一次归还
 * 3. 与流量无关的周期性日计数重置
 */
@Slf4j
public class QuotaEnforcer {

    private final Map<String, QuotaRecord> records = new ConcurrentHashMap<>();

    private final EngineConfig config;
    private final TenantTierResolver tierResolver;
    private final Clock clock;
    private final ZoneId resetZone;

    private volatile ScheduledFuture<?> sweepTask;

    public QuotaEnforcer(EngineConfig config, TenantTierResolver tierResolver, Clock clock) {
        this.config = config;
        this.tierResolver = tierResolver != null ? tierResolver : TenantTierResolver.fixed(QuotaTier.FREE);
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.resetZone = config.getQuotaResetZone();
    }

    // ==================== 准入 ====================

    /**
     * 只读预检：当日额度是否已用尽（不修改计数）
     */
    public QuotaOutcome checkDaily(String tenantId) {
        return mutate(tenantId, r -> r.dailyExhausted()
                ? QuotaOutcome.DAILY_LIMIT_EXCEEDED
                : QuotaOutcome.ADMITTED).getOutcome();
    }

    /**
     * 缓存命中：只消耗当日额度，不占用并发槽位
     */
    public QuotaDecision consumeDaily(String tenantId) {
        return mutate(tenantId, r -> {
            if (r.dailyExhausted()) {
                return QuotaOutcome.DAILY_LIMIT_EXCEEDED;
            }
            r.incrementDaily();
            return QuotaOutcome.ADMITTED;
        });
    }

    /**
     * 原子准入：当日额度与并发槽位同时检查并预留
     */
    public QuotaDecision checkAndReserve(String tenantId) {
        QuotaDecision decision = mutate(tenantId, r -> {
            if (r.dailyExhausted()) {
                return QuotaOutcome.DAILY_LIMIT_EXCEEDED;
            }
            if (r.concurrencyExhausted()) {
                return QuotaOutcome.CONCURRENCY_LIMIT_EXCEEDED;
            }
            r.incrementDaily();
            r.acquireSlot();
            return QuotaOutcome.ADMITTED;
        });

        if (!decision.isAdmitted()) {
            log.debug("[{}] Quota rejected: {}", tenantId, decision.getOutcome());
            return decision;
        }
        return new QuotaDecision(decision.getOutcome(), new QuotaReservation(tenantId, this), decision.getUsage());
    }

    /**
     * 由 {@link QuotaReservation} 调用，保证每个凭证只归还一次
     */
    void releaseSlot(String tenantId, boolean refundDaily) {
        records.computeIfPresent(tenantId, (id, r) -> {
            r.releaseSlot();
            if (refundDaily) {
                r.refundDaily();
            }
            return r;
        });
    }

    // ==================== 查询 ====================

    public QuotaUsage usage(String tenantId) {
        return mutate(tenantId, r -> QuotaOutcome.ADMITTED).getUsage();
    }

    public Optional<QuotaUsage> find(String tenantId) {
        if (!records.containsKey(tenantId)) {
            return Optional.empty();
        }
        return Optional.of(usage(tenantId));
    }

    /**
     * 套餐变更后刷新限额（不清空当日计数）
     */
    public void refreshTier(String tenantId) {
        records.computeIfPresent(tenantId, (id, r) -> {
            QuotaTier tier = tierResolver.resolve(id);
            r.applyTier(tier, config.limitsFor(tier));
            return r;
        });
    }

    // ==================== 周期重置 ====================

    /**
     * 重置所有到期租户的日计数
     *
     * @return 被重置的租户数
     */
    public int sweep() {
        Instant now = clock.instant();
        Instant next = nextResetAt();
        int[] count = {0};
        for (String tenantId : records.keySet()) {
            records.computeIfPresent(tenantId, (id, r) -> {
                if (r.resetIfDue(now, next)) {
                    count[0]++;
                }
                return r;
            });
        }
        if (count[0] > 0) {
            log.info("Daily quota reset for {} tenant(s), next reset at {}", count[0], next);
        }
        return count[0];
    }

    public void startSweeper(ScheduledExecutorService scheduler) {
        long interval = config.getQuotaSweepIntervalMs();
        this.sweepTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (Exception e) {
                log.error("Quota sweep failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    public void stopSweeper() {
        ScheduledFuture<?> task = this.sweepTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    // ==================== 内部方法 ====================

    private QuotaRecord newRecord(String tenantId) {
        QuotaTier tier = tierResolver.resolve(tenantId);
        return new QuotaRecord(tenantId, tier, config.limitsFor(tier), nextResetAt());
    }

    /**
     * 下一个重置点：配置时区的下一个零点
     */
    Instant nextResetAt() {
        LocalDate today = LocalDate.now(clock.withZone(resetZone));
        return today.plusDays(1).atStartOfDay(resetZone).toInstant();
    }

    /**
     * 所有读写都在 compute 临界区内完成，同一租户的操作天然串行
     */
    private QuotaDecision mutate(String tenantId, Function<QuotaRecord, QuotaOutcome> operation) {
        AtomicReference<QuotaDecision> holder = new AtomicReference<>();
        records.compute(tenantId, (id, current) -> {
            QuotaRecord r = current != null ? current : newRecord(id);
            r.resetIfDue(clock.instant(), nextResetAt());
            QuotaOutcome outcome = operation.apply(r);
            holder.set(new QuotaDecision(outcome, null, r.snapshot()));
            return r;
        });
        return holder.get();
    }
}
