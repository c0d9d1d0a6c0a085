package com.pluginexec.api.exception;

import com.pluginexec.api.model.ErrorKind;

/**
 * 沙箱违规异常
 * <p>
 * 由沙箱能力（网络、资源预算）在插件线程内抛出。
 * 即使插件捕获该异常，违规仍会被记录并决定最终结果。
 */
public class SandboxViolationException extends PluginExecException {

    private final ErrorKind kind;

    public SandboxViolationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SandboxViolationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
