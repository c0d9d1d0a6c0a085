package com.pluginexec.core.sandbox;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 取消令牌，由调用方设置，由执行监督线程轮询
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return 是否为首次取消
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
