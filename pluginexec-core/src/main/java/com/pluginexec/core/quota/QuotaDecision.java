package com.pluginexec.core.quota;

import lombok.Value;

/**
 * checkAndReserve 的返回值：准入时携带预留凭证
 */
@Value
public class QuotaDecision {
    QuotaOutcome outcome;
    QuotaReservation reservation;
    QuotaUsage usage;

    public boolean isAdmitted() {
        return outcome == QuotaOutcome.ADMITTED;
    }
}
