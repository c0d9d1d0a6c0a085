package com.pluginexec.api.plugin;

import java.util.Map;

/**
 * 插件动作：一个具名、参数化的能力
 * <p>
 * 实现只能通过 {@link SandboxContext} 获取外部能力。抛出的 Exception 视为插件自身的业务失败
 * （确定性，不重试）；逃逸出的 Error 视为沙箱单元崩溃。
 */
@FunctionalInterface
public interface PluginAction {

    Object execute(SandboxContext context, Map<String, Object> params) throws Exception;
}
