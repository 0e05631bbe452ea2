package avm.runtime.cache;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Caffeine 缓存功能测试
 */
public class CaffeineCacheTest {

    @Test
    public void testComputeIfAbsentComputesOnce() {
        BoundedCache<String, Integer> cache = new CaffeineCache<>(100);
        AtomicInteger loads = new AtomicInteger();

        Integer v1 = cache.computeIfAbsent("a", k -> loads.incrementAndGet());
        Integer v2 = cache.computeIfAbsent("a", k -> loads.incrementAndGet());

        assertEquals(v1, v2);
        assertEquals(1, loads.get());
        assertEquals(1L, cache.size());
    }

    @Test
    public void testEvictionKeepsSizeBounded() {
        BoundedCache<Integer, String> cache = new CaffeineCache<>(3);
        for (int i = 0; i < 20; i++) {
            cache.computeIfAbsent(i, String::valueOf);
        }
        // 维护任务在调用线程执行，size() 前已清理
        assertTrue(cache.size() <= 3, "Cache size should respect the bound");
        assertTrue(cache.getStats().getEvictionCount() >= 17);
    }

    @Test
    public void testStats() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        cache.computeIfAbsent("a", k -> "A");  // miss
        cache.get("a");                         // hit
        cache.get("b");                         // miss

        CacheStats stats = cache.getStats();
        assertEquals(1L, stats.getHitCount());
        assertEquals(2L, stats.getMissCount());
        assertEquals(1.0 / 3, stats.getHitRate(), 0.01);
        assertEquals(100L, stats.getMaximumSize());
    }

    @Test
    public void testClear() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);
        cache.computeIfAbsent("a", k -> "A");
        cache.clear();
        assertEquals(0L, cache.size());
        assertNull(cache.get("a"));
    }

    @Test
    public void testRejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineCache<String, String>(0));
    }
}
