package com.typebridge.retarget.cache;

/**
 * 解析结果缓存接口
 *
 * <p>会话期间只增不减，不淘汰。</p>
 */
public interface ResolutionCache<K, V> {

    /**
     * 获取缓存值（计入命中统计）
     *
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    void put(K key, V value);

    /**
     * 是否已缓存（不计入统计）
     */
    boolean contains(K key);

    long size();

    void clear();

    CacheStats getStats();
}
