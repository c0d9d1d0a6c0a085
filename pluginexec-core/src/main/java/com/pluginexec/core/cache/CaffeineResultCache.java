package com.pluginexec.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.pluginexec.api.model.ExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 基于 Caffeine 的结果缓存
 * <p>
 * 条目级 TTL 通过 {@link Expiry} 实现；读取时再按写入时间校验一次，
 * 保证不会返回已过期但尚未被清理的条目。
 */
@Slf4j
public class CaffeineResultCache implements ResultCache {

    private static final CacheKey PROBE_KEY = new CacheKey("__probe__", "__probe__", "", "");

    private final Cache<CacheKey, CacheEntry> cache;
    private final Ticker ticker;

    public CaffeineResultCache(long maxSize) {
        this(maxSize, Ticker.systemTicker());
    }

    public CaffeineResultCache(long maxSize, Ticker ticker) {
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .ticker(ticker)
                .expireAfter(new Expiry<CacheKey, CacheEntry>() {
                    @Override
                    public long expireAfterCreate(CacheKey key, CacheEntry entry, long currentTime) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterUpdate(CacheKey key, CacheEntry entry, long currentTime,
                                                  long currentDuration) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterRead(CacheKey key, CacheEntry entry, long currentTime,
                                                long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<ExecutionResult> get(CacheKey key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (ticker.read() - entry.insertedAtNanos >= entry.ttlNanos) {
            cache.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.result);
    }

    @Override
    public void put(CacheKey key, ExecutionResult result, long ttlMs) {
        if (ttlMs <= 0) {
            return;
        }
        cache.put(key, new CacheEntry(result, ticker.read(), TimeUnit.MILLISECONDS.toNanos(ttlMs)));
    }

    @Override
    public void invalidate(CacheKey key) {
        cache.invalidate(key);
    }

    @Override
    public int invalidatePlugin(String pluginId) {
        List<CacheKey> keys = cache.asMap().keySet().stream()
                .filter(k -> k.getPluginId().equals(pluginId))
                .collect(Collectors.toList());
        cache.invalidateAll(keys);
        int removed = keys.size();
        if (removed > 0) {
            log.info("[{}] Invalidated {} cached result(s)", pluginId, removed);
        }
        return removed;
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public boolean isResponsive() {
        try {
            cache.getIfPresent(PROBE_KEY);
            return true;
        } catch (RuntimeException e) {
            log.warn("Result cache probe failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 缓存条目：(result, insertedAt, ttl)
     */
    private static final class CacheEntry {
        final ExecutionResult result;
        final long insertedAtNanos;
        final long ttlNanos;

        CacheEntry(ExecutionResult result, long insertedAtNanos, long ttlNanos) {
            this.result = result;
            this.insertedAtNanos = insertedAtNanos;
            this.ttlNanos = ttlNanos;
        }
    }
}
