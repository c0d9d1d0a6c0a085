package com.pluginexec.core.engine;

import com.pluginexec.api.model.ExecutionResult;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * 已准入执行的句柄
 */
public class ExecutionHandle {

    private final String executionId;
    private final CompletableFuture<ExecutionResult> result;
    private final BooleanSupplier canceller;

    ExecutionHandle(String executionId, CompletableFuture<ExecutionResult> result, BooleanSupplier canceller) {
        this.executionId = executionId;
        this.result = result;
        this.canceller = canceller;
    }

    static ExecutionHandle completed(String executionId, ExecutionResult result) {
        return new ExecutionHandle(executionId, CompletableFuture.completedFuture(result), () -> false);
    }

    public String getExecutionId() {
        return executionId;
    }

    /**
     * 最终结果（含重试），不会异常完成
     */
    public CompletableFuture<ExecutionResult> getResult() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * 阻塞等待最终结果
     */
    public ExecutionResult await() {
        return result.join();
    }

    /**
     * 取消执行（幂等）：排队中直接移除，执行中走与超时相同的终止路径
     *
     * @return 本次调用是否触发了取消
     */
    public boolean cancel() {
        if (result.isDone()) {
            return false;
        }
        return canceller.getAsBoolean();
    }
}
