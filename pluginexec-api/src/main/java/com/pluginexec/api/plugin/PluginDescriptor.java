package com.pluginexec.api.plugin;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * 已解析的插件：ID + 版本 + 动作表
 * <p>
 * 由外部插件注册中心提供，版本参与缓存指纹计算。
 */
@Value
@Builder(toBuilder = true)
public class PluginDescriptor {

    String id;

    String version;

    @Singular
    Map<String, PluginAction> actions;

    public Optional<PluginAction> action(String actionName) {
        return Optional.ofNullable(actions.get(actionName));
    }
}
