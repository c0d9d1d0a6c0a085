package com.pluginexec.core.spi;

import com.pluginexec.api.plugin.PluginDescriptor;

import java.util.Optional;

/**
 * 插件注册中心 SPI（外部协作方）
 */
public interface PluginRegistry {

    Optional<PluginDescriptor> resolve(String pluginId);

    void addListener(PluginChangeListener listener);
}
