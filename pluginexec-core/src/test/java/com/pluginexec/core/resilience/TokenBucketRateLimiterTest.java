package com.pluginexec.core.resilience;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenBucketRateLimiter 单元测试")
public class TokenBucketRateLimiterTest {

    @Test
    @DisplayName("桶满时允许突发，耗尽后拒绝，随时间补充")
    void shouldAllowBurstThenRefill() {
        AtomicLong nanos = new AtomicLong(0);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("p1", 2.0, 2.0, nanos::get);

        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());

        nanos.addAndGet(500_000_000L);
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void shouldRejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter("p1", 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter("p1", 1, 0.5));
    }
}
