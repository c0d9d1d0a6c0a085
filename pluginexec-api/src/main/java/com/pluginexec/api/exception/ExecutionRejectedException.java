package com.pluginexec.api.exception;

import com.pluginexec.api.model.ErrorKind;

/**
 * 准入拒绝异常
 * <p>
 * 请求在进入工作进程之前被拒绝（配额、熔断、背压等），同步抛出给调用方，
 * 引擎不会对此类异常自动重试。
 */
public class ExecutionRejectedException extends PluginExecException {

    private final ErrorKind kind;
    private final String subject;

    public ExecutionRejectedException(ErrorKind kind, String subject, String message) {
        super(message);
        this.kind = kind;
        this.subject = subject;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 被拒绝的主体（租户ID或插件ID）
     */
    public String getSubject() {
        return subject;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
