package com.pluginexec.core.sandbox;

import com.pluginexec.api.exception.SandboxViolationException;
import com.pluginexec.api.plugin.SandboxContext;
import com.pluginexec.api.plugin.SandboxHttpClient;
import com.pluginexec.core.sandbox.network.GuardedHttpClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单次执行的沙箱上下文
 * <p>
 * 只暴露密钥读取、日志、受控网络和截止时间，不提供文件系统等其他能力。
 */
public class DefaultSandboxContext implements SandboxContext {

    private static final int MAX_LOG_LINES = 1000;

    private final String pluginId;
    private final String actionName;
    private final Map<String, String> secrets;
    private final SecretRedactor redactor;
    private final GuardedHttpClient httpClient;
    private final long deadlineNanos;
    private final CancellationToken cancellation;

    private final List<String> logs = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean terminated;

    public DefaultSandboxContext(String pluginId, String actionName, Map<String, String> secrets,
                                 SecretRedactor redactor, GuardedHttpClient httpClient,
                                 long deadlineNanos, CancellationToken cancellation) {
        this.pluginId = pluginId;
        this.actionName = actionName;
        this.secrets = secrets != null ? secrets : Map.of();
        this.redactor = redactor;
        this.httpClient = httpClient;
        this.deadlineNanos = deadlineNanos;
        this.cancellation = cancellation;
    }

    @Override
    public String getPluginId() {
        return pluginId;
    }

    @Override
    public String getActionName() {
        return actionName;
    }

    @Override
    public Optional<String> secret(String name) {
        return Optional.ofNullable(secrets.get(name));
    }

    @Override
    public void log(String message) {
        if (logs.size() < MAX_LOG_LINES) {
            logs.add(redactor.redact(message));
        }
    }

    /**
     * 引擎自身写入的日志行
     */
    void systemLog(String message) {
        logs.add("[sandbox] " + redactor.redact(message));
    }

    @Override
    public SandboxHttpClient http() {
        return httpClient;
    }

    @Override
    public long remainingMillis() {
        return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000);
    }

    @Override
    public boolean isCancelled() {
        return terminated || cancellation.isCancelled() || System.nanoTime() >= deadlineNanos;
    }

    void terminate() {
        this.terminated = true;
    }

    SandboxViolationException violation() {
        return httpClient.getViolation();
    }

    List<String> snapshotLogs() {
        synchronized (logs) {
            return new ArrayList<>(logs);
        }
    }
}
