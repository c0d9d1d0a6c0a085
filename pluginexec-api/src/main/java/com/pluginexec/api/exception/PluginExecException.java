package com.pluginexec.api.exception;

/**
 * 执行引擎基础异常
 *
 * @author PluginExec
 */
public class PluginExecException extends RuntimeException {

    public PluginExecException(String message) {
        super(message);
    }

    public PluginExecException(String message, Throwable cause) {
        super(message, cause);
    }
}
