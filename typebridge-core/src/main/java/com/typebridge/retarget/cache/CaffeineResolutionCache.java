package com.typebridge.retarget.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * 基于 Caffeine 的无界解析缓存
 *
 * <p>不设容量上限：会话短、类型宇宙小（几十到几千个类型）。</p>
 */
public final class CaffeineResolutionCache<K, V> implements ResolutionCache<K, V> {

    private final Cache<K, V> cache;

    public CaffeineResolutionCache(boolean recordStats) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (recordStats) {
            builder.recordStats();
        }
        this.cache = builder.build();
    }

    @Override
    public V get(K key) {
        return cache.getIfPresent(key);
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public boolean contains(K key) {
        return cache.asMap().containsKey(key);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        long total = stats.hitCount() + stats.missCount();
        return new CacheStats(stats.hitCount(), stats.missCount(),
                total > 0 ? stats.hitRate() : 0.0, cache.estimatedSize());
    }
}
