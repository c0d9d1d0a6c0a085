package com.pluginexec.starter.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.core.audit.AuditEventSink;
import com.pluginexec.core.audit.LoggingAuditEventSink;
import com.pluginexec.core.engine.PluginExecutionEngine;
import com.pluginexec.core.quota.TenantTierResolver;
import com.pluginexec.core.registry.InMemoryPluginRegistry;
import com.pluginexec.core.spi.PluginRegistry;
import com.pluginexec.starter.config.PluginExecProperties;
import com.pluginexec.starter.controller.ExecutionController;
import com.pluginexec.starter.controller.PluginExecOpsController;
import com.pluginexec.starter.service.ExecutionTaskStore;
import com.pluginexec.starter.web.PluginExecExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.stream.Collectors;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(PluginExecProperties.class)
@ConditionalOnProperty(prefix = "pluginexec", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import({ExecutionController.class, PluginExecOpsController.class, PluginExecExceptionHandler.class})
public class PluginExecAutoConfiguration {

    // 1. 宿主未提供时使用进程内指标注册表
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    // 2. 默认注册中心：收集容器内全部 PluginDescriptor Bean
    @Bean
    @ConditionalOnMissingBean(PluginRegistry.class)
    public InMemoryPluginRegistry pluginRegistry(ObjectProvider<PluginDescriptor> descriptors) {
        InMemoryPluginRegistry registry = new InMemoryPluginRegistry(
                descriptors.orderedStream().collect(Collectors.toList()));
        log.info("Plugin registry initialized with {} plugin(s)", registry.all().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantTierResolver tenantTierResolver(PluginExecProperties properties) {
        PluginExecProperties.Quota quota = properties.getQuota();
        return tenantId -> quota.getTenants().getOrDefault(tenantId, quota.getDefaultTier());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEventSink auditEventSink() {
        return new LoggingAuditEventSink();
    }

    // 3. 引擎本体，随容器启动与关闭
    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    public PluginExecutionEngine pluginExecutionEngine(PluginExecProperties properties,
                                                       PluginRegistry registry,
                                                       TenantTierResolver tierResolver,
                                                       AuditEventSink auditSink,
                                                       MeterRegistry meterRegistry,
                                                       ObjectProvider<ObjectMapper> objectMapper) {
        return PluginExecutionEngine.builder()
                .config(properties.toEngineConfig())
                .registry(registry)
                .tierResolver(tierResolver)
                .auditSink(auditSink)
                .meterRegistry(meterRegistry)
                .objectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionTaskStore executionTaskStore(PluginExecProperties properties) {
        return new ExecutionTaskStore(properties.getTasks().getRetention(), properties.getTasks().getMaxSize());
    }
}
