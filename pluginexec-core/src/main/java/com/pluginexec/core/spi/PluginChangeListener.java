package com.pluginexec.core.spi;

import com.pluginexec.api.plugin.PluginDescriptor;

/**
 * 插件变更监听
 */
public interface PluginChangeListener {

    default void onPluginUpdated(PluginDescriptor descriptor) {
    }

    default void onPluginRemoved(String pluginId) {
    }
}
