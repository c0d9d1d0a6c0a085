package com.pluginexec.api.exception;

import com.pluginexec.api.model.ErrorKind;

/**
 * 插件或动作未找到异常
 */
public class PluginNotFoundException extends ExecutionRejectedException {

    private final String pluginId;

    public PluginNotFoundException(String pluginId) {
        super(ErrorKind.PLUGIN_NOT_FOUND, pluginId, "Plugin not found: " + pluginId);
        this.pluginId = pluginId;
    }

    public PluginNotFoundException(String pluginId, String actionName) {
        super(ErrorKind.PLUGIN_NOT_FOUND, pluginId,
                "Action not found: " + pluginId + "#" + actionName);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
