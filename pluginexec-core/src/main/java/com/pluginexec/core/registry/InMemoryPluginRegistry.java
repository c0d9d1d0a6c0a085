package com.pluginexec.core.registry;

import com.pluginexec.api.plugin.PluginDescriptor;
import com.pluginexec.core.spi.PluginChangeListener;
import com.pluginexec.core.spi.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存插件注册中心
 * <p>
 * 覆盖已存在的插件时触发 onPluginUpdated，移除时触发 onPluginRemoved。
 */
@Slf4j
public class InMemoryPluginRegistry implements PluginRegistry {

    private final Map<String, PluginDescriptor> plugins = new ConcurrentHashMap<>();
    private final List<PluginChangeListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryPluginRegistry() {
    }

    public InMemoryPluginRegistry(Collection<PluginDescriptor> descriptors) {
        descriptors.forEach(this::register);
    }

    public void register(PluginDescriptor descriptor) {
        if (descriptor.getId() == null || descriptor.getId().isBlank()) {
            throw new IllegalArgumentException("Plugin id must not be blank");
        }
        PluginDescriptor previous = plugins.put(descriptor.getId(), descriptor);
        if (previous == null) {
            log.info("[{}] Plugin registered (version {}, actions {})",
                    descriptor.getId(), descriptor.getVersion(), descriptor.getActions().keySet());
            return;
        }
        log.info("[{}] Plugin updated: {} -> {}", descriptor.getId(), previous.getVersion(), descriptor.getVersion());
        for (PluginChangeListener listener : listeners) {
            listener.onPluginUpdated(descriptor);
        }
    }

    public boolean unregister(String pluginId) {
        if (plugins.remove(pluginId) == null) {
            return false;
        }
        log.info("[{}] Plugin removed", pluginId);
        for (PluginChangeListener listener : listeners) {
            listener.onPluginRemoved(pluginId);
        }
        return true;
    }

    @Override
    public Optional<PluginDescriptor> resolve(String pluginId) {
        return pluginId == null ? Optional.empty() : Optional.ofNullable(plugins.get(pluginId));
    }

    @Override
    public void addListener(PluginChangeListener listener) {
        listeners.add(listener);
    }

    public Collection<PluginDescriptor> all() {
        return Collections.unmodifiableCollection(plugins.values());
    }
}
