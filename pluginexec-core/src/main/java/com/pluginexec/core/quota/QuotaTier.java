package com.pluginexec.core.quota;

import lombok.Value;

/**
 * 租户套餐
 */
public enum QuotaTier {

    FREE(100, 2),
    STARTER(1_000, 5),
    PRO(100_000, 20),
    ENTERPRISE(Limits.UNLIMITED, 100);

    private final Limits defaultLimits;

    QuotaTier(long dailyLimit, int concurrencyLimit) {
        this.defaultLimits = new Limits(dailyLimit, concurrencyLimit);
    }

    public Limits defaultLimits() {
        return defaultLimits;
    }

    /**
     * 套餐限额，dailyLimit < 0 表示不限
     */
    @Value
    public static class Limits {
        public static final long UNLIMITED = -1;

        long dailyLimit;
        int concurrencyLimit;

        public boolean isDailyUnlimited() {
            return dailyLimit < 0;
        }
    }
}
