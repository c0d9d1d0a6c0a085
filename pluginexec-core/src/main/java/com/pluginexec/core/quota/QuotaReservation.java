package com.pluginexec.core.quota;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 并发槽位预留凭证
 * <p>
 * release / cancel 二选一且只生效一次，保证并发计数恰好归还一次。
 */
public class QuotaReservation {

    private final String tenantId;
    private final QuotaEnforcer enforcer;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    QuotaReservation(String tenantId, QuotaEnforcer enforcer) {
        this.tenantId = tenantId;
        this.enforcer = enforcer;
    }

    public String getTenantId() {
        return tenantId;
    }

    /**
     * 执行结束（成功、失败或超时）后归还槽位
     *
     * @return 本次调用是否真正归还
     */
    public boolean release() {
        if (settled.compareAndSet(false, true)) {
            enforcer.releaseSlot(tenantId, false);
            return true;
        }
        return false;
    }

    /**
     * 请求从未执行（熔断、背压拒绝）：归还槽位并退还当日计数
     */
    public boolean cancel() {
        if (settled.compareAndSet(false, true)) {
            enforcer.releaseSlot(tenantId, true);
            return true;
        }
        return false;
    }

    public boolean isSettled() {
        return settled.get();
    }
}
