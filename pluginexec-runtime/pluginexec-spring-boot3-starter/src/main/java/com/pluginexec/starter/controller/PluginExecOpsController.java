package com.pluginexec.starter.controller;

import com.pluginexec.core.engine.HealthSnapshot;
import com.pluginexec.core.engine.PluginExecutionEngine;
import com.pluginexec.starter.dto.HealthDTO;
import com.pluginexec.starter.dto.QuotaUsageDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 运维接口：健康、指标、租户配额
 */
@RestController
@RequiredArgsConstructor
public class PluginExecOpsController {

    private final PluginExecutionEngine engine;

    @GetMapping("/health")
    public ResponseEntity<HealthDTO> health() {
        HealthSnapshot snapshot = engine.health();
        HttpStatus status = snapshot.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(HealthDTO.from(snapshot));
    }

    @GetMapping("/metrics")
    public Map<String, Map<String, Double>> metrics() {
        return engine.getMetrics().snapshot();
    }

    @GetMapping("/quota/{tenantId}")
    public QuotaUsageDTO quota(@PathVariable String tenantId) {
        return QuotaUsageDTO.from(engine.quotaUsage(tenantId));
    }
}
