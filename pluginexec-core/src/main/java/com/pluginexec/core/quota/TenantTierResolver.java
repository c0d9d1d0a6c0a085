package com.pluginexec.core.quota;

/**
 * 租户套餐解析 SPI
 */
@FunctionalInterface
public interface TenantTierResolver {

    QuotaTier resolve(String tenantId);

    static TenantTierResolver fixed(QuotaTier tier) {
        return tenantId -> tier;
    }
}
