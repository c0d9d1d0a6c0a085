package com.pluginexec.core.quota;

import com.pluginexec.api.model.ErrorKind;

/**
 * 配额准入结果
 */
public enum QuotaOutcome {
    ADMITTED(null),
    DAILY_LIMIT_EXCEEDED(ErrorKind.DAILY_LIMIT_EXCEEDED),
    CONCURRENCY_LIMIT_EXCEEDED(ErrorKind.CONCURRENCY_LIMIT_EXCEEDED);

    private final ErrorKind errorKind;

    QuotaOutcome(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }
}
