package com.typebridge.retarget.cache;

/**
 * 缓存统计信息
 */
public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final double hitRate;
    private final long size;

    public CacheStats(long hitCount, long missCount, double hitRate, long size) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.hitRate = hitRate;
        this.size = size;
    }

    public long getHitCount() { return hitCount; }
    public long getMissCount() { return missCount; }
    public double getHitRate() { return hitRate; }
    public long getSize() { return size; }

    @Override
    public String toString() {
        return String.format("hits=%d, misses=%d, hitRate=%.2f%%, size=%d",
                hitCount, missCount, hitRate * 100, size);
    }
}
