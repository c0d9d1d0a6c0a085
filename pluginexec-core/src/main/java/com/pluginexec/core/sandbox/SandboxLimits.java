package com.pluginexec.core.sandbox;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 单次执行的资源限制
 */
@Value
@Builder(toBuilder = true)
public class SandboxLimits {

    /**
     * 执行期间单元线程允许分配的字节数
     */
    long maxMemoryBytes;

    /**
     * CPU 占用上限（仅监控告警）
     */
    int maxCpuPercent;

    long timeoutMs;

    @Singular
    List<String> allowedDomains;

    double networkRateLimit;

    long maxNetworkBytes;

    public SandboxLimits withTimeoutMs(long timeoutMs) {
        return toBuilder().timeoutMs(timeoutMs).build();
    }
}
