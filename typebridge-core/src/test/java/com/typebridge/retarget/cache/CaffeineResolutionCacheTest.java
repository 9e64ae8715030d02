package com.typebridge.retarget.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CaffeineResolutionCache 测试")
class CaffeineResolutionCacheTest {

    @Test
    @DisplayName("存取与清空")
    void putGetClear() {
        ResolutionCache<String, Integer> cache = new CaffeineResolutionCache<>(false);
        assertThat(cache.get("a")).isNull();

        cache.put("a", 1);
        cache.put("b", 2);
        assertThat(cache.get("a")).isEqualTo(1);
        assertThat(cache.contains("b")).isTrue();
        assertThat(cache.size()).isEqualTo(2);

        cache.clear();
        assertThat(cache.contains("a")).isFalse();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("contains 不计入命中统计")
    void containsDoesNotTouchStats() {
        ResolutionCache<String, Integer> cache = new CaffeineResolutionCache<>(true);
        cache.put("a", 1);
        cache.contains("a");
        cache.contains("b");

        CacheStats stats = cache.getStats();
        assertThat(stats.getHitCount()).isZero();
        assertThat(stats.getMissCount()).isZero();
        assertThat(stats.getHitRate()).isZero();
    }

    @Test
    @DisplayName("命中率")
    void hitRate() {
        ResolutionCache<String, Integer> cache = new CaffeineResolutionCache<>(true);
        cache.get("a");
        cache.put("a", 1);
        cache.get("a");
        cache.get("a");
        cache.get("a");

        CacheStats stats = cache.getStats();
        assertThat(stats.getHitCount()).isEqualTo(3);
        assertThat(stats.getMissCount()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(0.75);
        assertThat(stats.toString()).contains("hits=3").contains("size=1");
    }

    @Test
    @DisplayName("未开启统计时计数为零")
    void statsDisabled() {
        ResolutionCache<String, Integer> cache = new CaffeineResolutionCache<>(false);
        cache.get("a");
        assertThat(cache.getStats().getMissCount()).isZero();
    }
}
