package com.pluginexec.core.pool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginexec.api.exception.ExecutionRejectedException;
import com.pluginexec.api.model.ErrorKind;
import com.pluginexec.api.model.ExecutionResult;
import com.pluginexec.core.config.EngineConfig;
import com.pluginexec.core.event.EventBus;
import com.pluginexec.core.queue.QueuedExecution;
import com.pluginexec.core.queue.RequestQueue;
import com.pluginexec.core.sandbox.SandboxedRuntime;
import com.pluginexec.core.sandbox.network.NetworkGuard;
import com.pluginexec.core.spi.IsolatedUnitFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 工作进程池管理器
 * <p>
 * 职责：
 * 1. 分配：优先空闲进程，其次扩容（不超过 maxWorkers），否则入队，队满拒绝
 * 2. 回收：执行次数达到上限后退役
 * 3. 崩溃恢复：单元死亡只影响当次执行，槽位以新代数重启
 * 4. 空闲淘汰：超过空闲时间的进程缩容到 minWorkers
 * <p>
 * 所有分配决策都在 poolLock 内完成；进程状态迁移使用 CAS。
 */
@Slf4j
public class WorkerPoolManager {

    private final EngineConfig config;
    private final IsolatedUnitFactory unitFactory;
    private final NetworkGuard networkGuard;
    private final ObjectMapper objectMapper;
    private final RequestQueue queue;
    private final EventBus eventBus;

    private final ReentrantLock poolLock = new ReentrantLock();
    private final List<Worker> workers = new ArrayList<>();
    private final AtomicInteger workerSeq = new AtomicInteger();
    private final ExecutorService supervisors;

    private volatile boolean shutdown;

    public WorkerPoolManager(EngineConfig config, IsolatedUnitFactory unitFactory, NetworkGuard networkGuard,
                             ObjectMapper objectMapper, RequestQueue queue, EventBus eventBus) {
        this.config = config;
        this.unitFactory = unitFactory;
        this.networkGuard = networkGuard;
        this.objectMapper = objectMapper;
        this.queue = queue;
        this.eventBus = eventBus;

        AtomicInteger threadSeq = new AtomicInteger();
        this.supervisors = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pluginexec-supervisor-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 预创建 minWorkers 个工作进程
     */
    public void start() {
        poolLock.lock();
        try {
            while (workers.size() < config.getMinWorkers()) {
                createWorker();
            }
        } finally {
            poolLock.unlock();
        }
        log.info("Worker pool started: min={}, max={}, queueCapacity={}",
                config.getMinWorkers(), config.getMaxWorkers(), queue.capacity());
    }

    /**
     * 提交执行：立即分配或入队
     *
     * @throws ExecutionRejectedException 队列已满（QUEUE_FULL）
     */
    public void submit(QueuedExecution execution) {
        Worker worker;
        poolLock.lock();
        try {
            if (shutdown) {
                throw new ExecutionRejectedException(ErrorKind.QUEUE_FULL, execution.getPlugin().getId(),
                        "Worker pool is shut down");
            }
            worker = acquireWorker();
            if (worker == null) {
                if (!queue.offer(execution)) {
                    log.warn("[{}] Request queue is full (capacity {}), rejecting {}",
                            execution.getPlugin().getId(), queue.capacity(), execution.getExecutionId());
                    throw new ExecutionRejectedException(ErrorKind.QUEUE_FULL, execution.getPlugin().getId(),
                            "Request queue is full (capacity " + queue.capacity() + ")");
                }
                log.debug("[{}] No worker available, queued {} (depth={})",
                        execution.getPlugin().getId(), execution.getExecutionId(), queue.size());
                return;
            }
        } finally {
            poolLock.unlock();
        }
        dispatch(worker, execution);
    }

    /**
     * 取消仍在排队的请求
     *
     * @return 是否从队列中移除
     */
    public boolean cancelQueued(QueuedExecution execution) {
        if (queue.remove(execution)) {
            execution.complete(ExecutionResult.failure(ErrorKind.CANCELLED, "Execution cancelled while queued", 0),
                    null);
            return true;
        }
        return false;
    }

    /**
     * 以 TIMEOUT 结束等待过久的排队请求
     */
    public int expireQueued() {
        long maxWaitNanos = TimeUnit.MILLISECONDS.toNanos(config.getMaxQueueWaitMs());
        List<QueuedExecution> expired = queue.expire(System.nanoTime(), maxWaitNanos);
        for (QueuedExecution e : expired) {
            e.complete(ExecutionResult.failure(ErrorKind.TIMEOUT,
                    "Request waited longer than " + config.getMaxQueueWaitMs() + "ms in queue",
                    config.getMaxQueueWaitMs()), null);
        }
        return expired.size();
    }

    /**
     * 淘汰空闲超时的工作进程，保留 minWorkers
     */
    public int evictIdle() {
        List<Worker> evicted = new ArrayList<>();
        long now = System.currentTimeMillis();
        poolLock.lock();
        try {
            int live = workers.size();
            Iterator<Worker> it = workers.iterator();
            while (it.hasNext() && live > config.getMinWorkers()) {
                Worker w = it.next();
                if (w.getState() == WorkerState.IDLE
                        && now - w.getLastUsedMillis() >= config.getWorkerIdleTimeoutMs()
                        && w.transition(WorkerState.IDLE, WorkerState.RECYCLING)) {
                    it.remove();
                    evicted.add(w);
                    live--;
                }
            }
        } finally {
            poolLock.unlock();
        }
        for (Worker w : evicted) {
            terminate(w);
        }
        if (!evicted.isEmpty()) {
            log.info("Evicted {} idle worker(s)", evicted.size());
        }
        return evicted.size();
    }

    public PoolStats stats() {
        Map<WorkerState, Integer> states = new EnumMap<>(WorkerState.class);
        int total;
        poolLock.lock();
        try {
            total = workers.size();
            for (Worker w : workers) {
                states.merge(w.getState(), 1, Integer::sum);
            }
        } finally {
            poolLock.unlock();
        }
        return new PoolStats(total, config.getMinWorkers(), config.getMaxWorkers(), states,
                queue.size(), queue.capacity());
    }

    public List<Worker> snapshot() {
        poolLock.lock();
        try {
            return new ArrayList<>(workers);
        } finally {
            poolLock.unlock();
        }
    }

    public RequestQueue getQueue() {
        return queue;
    }

    /**
     * 关闭：排队请求以 CANCELLED 结束，终止全部工作进程
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        List<Worker> all;
        poolLock.lock();
        try {
            shutdown = true;
            all = new ArrayList<>(workers);
            workers.clear();
        } finally {
            poolLock.unlock();
        }
        for (QueuedExecution e : queue.drain()) {
            e.complete(ExecutionResult.failure(ErrorKind.CANCELLED, "Engine is shutting down", 0), null);
        }
        for (Worker w : all) {
            w.getRuntime().shutdown();
            w.forceTerminate();
        }
        supervisors.shutdownNow();
        log.info("Worker pool shut down ({} worker(s) terminated)", all.size());
    }

    // ==================== 内部方法 ====================

    /**
     * 需持有 poolLock：空闲优先，其次扩容
     */
    private Worker acquireWorker() {
        for (Worker w : workers) {
            if (w.transition(WorkerState.IDLE, WorkerState.BUSY)) {
                return w;
            }
        }
        if (workers.size() < config.getMaxWorkers()) {
            Worker w = createWorker();
            if (w.transition(WorkerState.IDLE, WorkerState.BUSY)) {
                return w;
            }
        }
        return null;
    }

    /**
     * 需持有 poolLock
     */
    private Worker createWorker() {
        String id = "worker-" + workerSeq.incrementAndGet();
        SandboxedRuntime runtime = new SandboxedRuntime(id, unitFactory, networkGuard, objectMapper);
        runtime.start();
        Worker worker = new Worker(id, runtime, eventBus);
        workers.add(worker);
        log.info("[{}] Worker spawned ({} live)", id, workers.size());
        return worker;
    }

    private void dispatch(Worker worker, QueuedExecution execution) {
        try {
            supervisors.execute(() -> runLoop(worker, execution));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Supervisor rejected {}, pool is shutting down", worker.getId(), execution.getExecutionId());
            execution.complete(ExecutionResult.failure(ErrorKind.CANCELLED, "Engine is shutting down", 0), null);
        }
    }

    /**
     * 监督线程主循环：执行完当前请求后直接从队列取下一个
     */
    private void runLoop(Worker worker, QueuedExecution first) {
        QueuedExecution current = first;
        while (current != null) {
            if (current.getCancellation().isCancelled()) {
                QueuedExecution next = afterExecution(worker, false);
                current.complete(ExecutionResult.failure(ErrorKind.CANCELLED,
                        "Execution cancelled before start", 0), null);
                current = next;
                continue;
            }

            ExecutionResult result;
            try {
                result = worker.getRuntime().execute(current.getPlugin(), current.getActionName(),
                        current.getParams(), current.getSecrets(), current.getLimits(), current.getCancellation());
            } catch (RuntimeException e) {
                log.error("[{}] Sandbox runtime failed unexpectedly", worker.getId(), e);
                worker.getRuntime().shutdown();
                result = ExecutionResult.failure(ErrorKind.CRASHED_PROCESS,
                        "Sandbox runtime failure: " + e.getMessage(), 0);
            }

            QueuedExecution next = afterExecution(worker, true);
            current.complete(result, worker.getId());
            current = next;
        }
    }

    /**
     * 执行后处理：崩溃重启、回收或交还，并在同一把锁内取出下一个排队请求
     *
     * @return 由当前工作进程继续执行的请求
     */
    private QueuedExecution afterExecution(Worker worker, boolean ran) {
        if (shutdown) {
            return null;
        }
        int count = ran ? worker.recordExecution() : worker.getExecutions();

        boolean crashed = !worker.getRuntime().isHealthy();
        if (crashed) {
            worker.transition(WorkerState.BUSY, WorkerState.CRASHED);
            if (!restart(worker)) {
                return replace(worker, WorkerState.CRASHED);
            }
        } else if (count >= config.getMaxExecutionsPerWorker()) {
            log.info("[{}] Reached {} executions, recycling", worker.getId(), count);
            return replace(worker, WorkerState.BUSY);
        }

        WorkerState from = crashed ? WorkerState.CRASHED : WorkerState.BUSY;
        poolLock.lock();
        try {
            QueuedExecution next = shutdown ? null : queue.poll();
            if (next != null) {
                if (crashed) {
                    worker.transition(WorkerState.CRASHED, WorkerState.IDLE);
                    worker.transition(WorkerState.IDLE, WorkerState.BUSY);
                }
                return next;
            }
            worker.transition(from, WorkerState.IDLE);
            return null;
        } finally {
            poolLock.unlock();
        }
    }

    private boolean restart(Worker worker) {
        try {
            worker.getRuntime().restart();
            worker.resetExecutions();
            return true;
        } catch (RuntimeException e) {
            log.error("[{}] Failed to restart sandbox unit", worker.getId(), e);
            return false;
        }
    }

    /**
     * 退役工作进程；如有排队请求则分配给替补进程
     */
    private QueuedExecution replace(Worker worker, WorkerState from) {
        Worker replacement = null;
        QueuedExecution next = null;
        poolLock.lock();
        try {
            worker.transition(from, WorkerState.RECYCLING);
            workers.remove(worker);
            if (!shutdown && queue.size() > 0) {
                replacement = acquireWorker();
                if (replacement != null) {
                    next = queue.poll();
                    if (next == null) {
                        replacement.transition(WorkerState.BUSY, WorkerState.IDLE);
                    }
                }
            }
            while (!shutdown && workers.size() < config.getMinWorkers()) {
                createWorker();
            }
        } finally {
            poolLock.unlock();
        }
        terminate(worker);
        if (next != null) {
            dispatch(replacement, next);
        }
        return null;
    }

    private void terminate(Worker worker) {
        worker.getRuntime().shutdown();
        worker.transition(WorkerState.RECYCLING, WorkerState.TERMINATED);
        log.info("[{}] Worker terminated after {} execution(s)", worker.getId(), worker.getExecutions());
    }
}
