package avm.runtime.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>条目可能被淘汰，调用方必须能在未命中时重新计算出等价的值。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * 获取缓存值
     *
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 如果不存在则计算并缓存
     *
     * @param mappingFunction 计算函数
     * @return 缓存值（可能是新计算的）
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    long size();

    void clear();

    /**
     * 获取缓存统计
     */
    CacheStats getStats();
}
