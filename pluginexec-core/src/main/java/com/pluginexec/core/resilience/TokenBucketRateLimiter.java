package com.pluginexec.core.resilience;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 令牌桶限流器 (Token Bucket)
 * <p>
 * 用于沙箱出站网络请求限速，允许短时突发。
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private final String name;
    private final double ratePerSecond; // 每秒生成令牌数
    private final double maxTokens; // 桶容量
    private final LongSupplier nanoClock;

    private final AtomicReference<Bucket> bucket;

    private static final class Bucket {
        final double tokens;
        final long lastRefillNanos;

        Bucket(double tokens, long lastRefillNanos) {
            this.tokens = tokens;
            this.lastRefillNanos = lastRefillNanos;
        }
    }

    public TokenBucketRateLimiter(String name, double ratePerSecond, double maxTokens) {
        this(name, ratePerSecond, maxTokens, System::nanoTime);
    }

    public TokenBucketRateLimiter(String name, double ratePerSecond, double maxTokens, LongSupplier nanoClock) {
        if (ratePerSecond <= 0 || maxTokens < 1) {
            throw new IllegalArgumentException("Invalid token bucket: rate=" + ratePerSecond + ", capacity=" + maxTokens);
        }
        this.name = name;
        this.ratePerSecond = ratePerSecond;
        this.maxTokens = maxTokens;
        this.nanoClock = nanoClock;

        // 初始装满
        this.bucket = new AtomicReference<>(new Bucket(maxTokens, nanoClock.getAsLong()));
    }

    @Override
    public boolean tryAcquire() {
        while (true) {
            Bucket current = bucket.get();
            long now = nanoClock.getAsLong();

            double refilled = (now - current.lastRefillNanos) * ratePerSecond / 1_000_000_000.0;
            double available = Math.min(maxTokens, current.tokens + refilled);

            if (available < 1.0) {
                // 令牌不足时不推进时间戳，下次按原时间点继续累积
                return false;
            }
            if (bucket.compareAndSet(current, new Bucket(available - 1.0, now))) {
                return true;
            }
            // CAS 失败，重试
        }
    }

    @Override
    public String getName() {
        return name;
    }
}
