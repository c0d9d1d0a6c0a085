package com.pluginexec.core.queue;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongConsumer;

/**
 * 有界优先级队列
 * <p>
 * 同优先级按到达顺序出队；入队从不阻塞，满时直接返回 false。容量为 0 时等价于纯背压。
 */
@Slf4j
public class RequestQueue {

    private static final Comparator<QueuedExecution> ORDER = Comparator
            .comparingInt((QueuedExecution e) -> e.getPriority().ordinal())
            .thenComparingLong(QueuedExecution::getSequence);

    private final int capacity;
    private final LongConsumer waitRecorder;
    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<QueuedExecution> heap = new PriorityQueue<>(ORDER);

    private long sequence;

    public RequestQueue(int capacity) {
        this(capacity, null);
    }

    /**
     * @param waitRecorder 出队时回调排队耗时（纳秒）
     */
    public RequestQueue(int capacity, LongConsumer waitRecorder) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Queue capacity must be >= 0");
        }
        this.capacity = capacity;
        this.waitRecorder = waitRecorder;
    }

    public boolean offer(QueuedExecution execution) {
        lock.lock();
        try {
            if (heap.size() >= capacity) {
                return false;
            }
            execution.markEnqueued(sequence++, System.nanoTime());
            heap.add(execution);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取出最高优先级中最早到达的请求，队列为空返回 null
     */
    public QueuedExecution poll() {
        QueuedExecution next;
        lock.lock();
        try {
            next = heap.poll();
        } finally {
            lock.unlock();
        }
        if (next != null && waitRecorder != null) {
            waitRecorder.accept(System.nanoTime() - next.getEnqueuedAtNanos());
        }
        return next;
    }

    public boolean remove(QueuedExecution execution) {
        lock.lock();
        try {
            return heap.remove(execution);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除等待超过 maxWaitNanos 的请求
     *
     * @return 被移除的请求，由调用方负责以超时结束
     */
    public List<QueuedExecution> expire(long nowNanos, long maxWaitNanos) {
        List<QueuedExecution> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<QueuedExecution> it = heap.iterator();
            while (it.hasNext()) {
                QueuedExecution e = it.next();
                if (nowNanos - e.getEnqueuedAtNanos() >= maxWaitNanos) {
                    it.remove();
                    expired.add(e);
                }
            }
        } finally {
            lock.unlock();
        }
        if (!expired.isEmpty()) {
            log.warn("Expired {} queued request(s) after waiting {}ms", expired.size(), maxWaitNanos / 1_000_000);
        }
        return expired;
    }

    /**
     * 关闭时取出全部请求
     */
    public List<QueuedExecution> drain() {
        lock.lock();
        try {
            List<QueuedExecution> all = new ArrayList<>(heap);
            heap.clear();
            return all;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
