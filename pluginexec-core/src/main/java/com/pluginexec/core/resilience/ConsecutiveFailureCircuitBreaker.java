package com.pluginexec.core.resilience;

import com.pluginexec.core.event.EngineEvents;
import com.pluginexec.core.event.EventBus;
import lombok.extern.slf4j.Slf4j;

import java.util.function.LongSupplier;

/**
 * 连续失败计数熔断器
 * <p>
 * CLOSED: 连续失败达到 failureThreshold -> OPEN
 * OPEN: 拒绝全部请求，resetTimeout 后 -> HALF_OPEN
 * HALF_OPEN: 最多放行 halfOpenMaxRequests 个试探请求，任一失败 -> OPEN（重新计时），
 * 全部成功 -> CLOSED（计数清零）
 * <p>
 * 状态只通过 transitionTo 修改，所有变更在对象监视器内完成。
 */
@Slf4j
public class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final int halfOpenMaxRequests;
    private final LongSupplier clock;
    private final EventBus eventBus;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private long openedAt;

    // Half-Open 状态下的试探计数
    private int halfOpenIssued;
    private int halfOpenSucceeded;

    public ConsecutiveFailureCircuitBreaker(String name, int failureThreshold, long resetTimeoutMs,
                                            int halfOpenMaxRequests) {
        this(name, failureThreshold, resetTimeoutMs, halfOpenMaxRequests, System::currentTimeMillis, null);
    }

    public ConsecutiveFailureCircuitBreaker(String name, int failureThreshold, long resetTimeoutMs,
                                            int halfOpenMaxRequests, LongSupplier clock, EventBus eventBus) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMs = resetTimeoutMs;
        this.halfOpenMaxRequests = halfOpenMaxRequests;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    @Override
    public synchronized boolean tryAcquirePermission() {
        if (state == State.OPEN) {
            if (clock.getAsLong() - openedAt < resetTimeoutMs) {
                return false;
            }
            transitionTo(State.HALF_OPEN);
        }

        if (state == State.HALF_OPEN) {
            if (halfOpenIssued >= halfOpenMaxRequests) {
                return false;
            }
            halfOpenIssued++;
            return true;
        }

        return true;
    }

    @Override
    public synchronized void releasePermission() {
        if (state == State.HALF_OPEN && halfOpenIssued > halfOpenSucceeded) {
            halfOpenIssued--;
        }
    }

    @Override
    public synchronized void onSuccess() {
        switch (state) {
            case CLOSED:
                consecutiveFailures = 0;
                break;
            case HALF_OPEN:
                halfOpenSucceeded++;
                if (halfOpenSucceeded >= halfOpenMaxRequests) {
                    transitionTo(State.CLOSED);
                }
                break;
            default:
                // OPEN 期间完成的旧请求不影响状态
                break;
        }
    }

    @Override
    public synchronized void onError(Throwable throwable) {
        switch (state) {
            case CLOSED:
                consecutiveFailures++;
                if (consecutiveFailures >= failureThreshold) {
                    log.warn("[Breaker:{}] {} consecutive failures reached threshold {}. OPENING.",
                            name, consecutiveFailures, failureThreshold);
                    transitionTo(State.OPEN);
                }
                break;
            case HALF_OPEN:
                log.warn("[Breaker:{}] Probe failed, reopening: {}", name,
                        throwable != null ? throwable.getMessage() : "unknown");
                transitionTo(State.OPEN);
                break;
            default:
                break;
        }
    }

    private void transitionTo(State newState) {
        State oldState = this.state;
        if (oldState == newState) {
            return;
        }
        this.state = newState;
        switch (newState) {
            case OPEN:
                openedAt = clock.getAsLong();
                break;
            case HALF_OPEN:
                halfOpenIssued = 0;
                halfOpenSucceeded = 0;
                break;
            case CLOSED:
                consecutiveFailures = 0;
                break;
            default:
                break;
        }
        log.info("[Breaker:{}] State changed: {} -> {}", name, oldState, newState);
        if (eventBus != null) {
            eventBus.publish(new EngineEvents.CircuitBreakerStateEvent(name, oldState, newState));
        }
    }

    @Override
    public synchronized State getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized long getOpenedAt() {
        return openedAt;
    }

    @Override
    public String getName() {
        return name;
    }
}
