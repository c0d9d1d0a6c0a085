package com.pluginexec.core.resilience;

import com.pluginexec.core.event.EngineEvents;
import com.pluginexec.core.event.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConsecutiveFailureCircuitBreaker 单元测试")
public class ConsecutiveFailureCircuitBreakerTest {

    private static final RuntimeException FAILURE = new RuntimeException("failed");

    private AtomicLong now;
    private List<EngineEvents.CircuitBreakerStateEvent> events;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_000);
        events = new ArrayList<>();
        eventBus = new EventBus();
        eventBus.subscribe(EngineEvents.CircuitBreakerStateEvent.class, events::add);
    }

    private ConsecutiveFailureCircuitBreaker breaker(int threshold, int halfOpenMax) {
        return new ConsecutiveFailureCircuitBreaker("p1", threshold, 60_000, halfOpenMax, now::get, eventBus);
    }

    private void fail(CircuitBreaker breaker, int times) {
        for (int i = 0; i < times; i++) {
            assertTrue(breaker.tryAcquirePermission());
            breaker.onError(FAILURE);
        }
    }

    @Nested
    @DisplayName("CLOSED 状态")
    class ClosedTests {

        @Test
        @DisplayName("连续失败达到阈值后打开")
        void shouldOpenAtThreshold() {
            ConsecutiveFailureCircuitBreaker breaker = breaker(5, 1);

            fail(breaker, 4);
            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());

            fail(breaker, 1);
            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
            assertFalse(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("成功会清零连续失败计数")
        void successShouldResetCounter() {
            ConsecutiveFailureCircuitBreaker breaker = breaker(3, 1);

            fail(breaker, 2);
            breaker.onSuccess();
            fail(breaker, 2);

            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
            assertEquals(2, breaker.getConsecutiveFailures());
        }
    }

    @Nested
    @DisplayName("OPEN 与 HALF_OPEN 状态")
    class OpenTests {

        @Test
        @DisplayName("resetTimeout 之前一直拒绝")
        void shouldRejectUntilResetTimeout() {
            ConsecutiveFailureCircuitBreaker breaker = breaker(5, 1);
            fail(breaker, 5);

            now.addAndGet(59_999);
            assertFalse(breaker.tryAcquirePermission());
            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        }

        @Test
        @DisplayName("resetTimeout 之后恰好放行一个试探请求，成功则关闭")
        void shouldAdmitExactlyOneProbeThenClose() {
            ConsecutiveFailureCircuitBreaker breaker = breaker(5, 1);
            fail(breaker, 5);
            now.addAndGet(60_000);

            assertTrue(breaker.tryAcquirePermission());
            assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
            assertFalse(breaker.tryAcquirePermission(), "第二个并发试探应被拒绝");

            breaker.onSuccess();
            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
            assertEquals(0, breaker.getConsecutiveFailures());
        }

        @Test
        @DisplayName("试探失败重新打开并重新计时")
        void probeFailureShouldReopen() {
            ConsecutiveFailureCircuitBreaker breaker = breaker(5, 1);
            fail(breaker, 5);
            now.addAndGet(60_000);

            assertTrue(breaker.tryAcquirePermission());
            breaker.onError(FAILURE);

            assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
            assertEquals(now.get(), breaker.getOpenedAt());
            now.addAndGet(30_000);
            assertFalse(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("halfOpenMaxRequests 个试探全部成功才关闭")
        void shouldRequireAllProbesToSucceed() {
            ConsecutiveFailureCircuitBreaker breaker = breaker(1, 3);
            fail(breaker, 1);
            now.addAndGet(60_000);

            assertTrue(breaker.tryAcquirePermission());
            assertTrue(breaker.tryAcquirePermission());
            assertTrue(breaker.tryAcquirePermission());
            assertFalse(breaker.tryAcquirePermission());

            breaker.onSuccess();
            breaker.onSuccess();
            assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
            breaker.onSuccess();
            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        }

        @Test
        @DisplayName("未执行的试探归还许可后可再次试探")
        void releasedProbeShouldFreeSlot() {
            ConsecutiveFailureCircuitBreaker breaker = breaker(1, 1);
            fail(breaker, 1);
            now.addAndGet(60_000);

            assertTrue(breaker.tryAcquirePermission());
            breaker.releasePermission();

            assertTrue(breaker.tryAcquirePermission());
        }
    }

    @Test
    @DisplayName("状态迁移发布事件")
    void transitionsShouldBePublished() {
        ConsecutiveFailureCircuitBreaker breaker = breaker(1, 1);
        fail(breaker, 1);
        now.addAndGet(60_000);
        breaker.tryAcquirePermission();
        breaker.onSuccess();

        assertEquals(3, events.size());
        assertEquals(CircuitBreaker.State.OPEN, events.get(0).getNewState());
        assertEquals(CircuitBreaker.State.HALF_OPEN, events.get(1).getNewState());
        assertEquals(CircuitBreaker.State.CLOSED, events.get(2).getNewState());
        assertEquals("p1", events.get(0).getPluginId());
    }
}
