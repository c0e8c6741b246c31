package com.github.lrucache.cache;

import java.util.Map;

/**
 * 缓存对外接口；null 表示“不存在”，因此 key 和 value 都不允许为 null
 */
public interface Cache<K, V> {
    V get(K key);
    void put(K key, V value);
    V remove(K key);
    boolean contains(K key);

    /**
     * 存活条目数，不包含已过期的条目
     * <p>
     * 启用过期时，每个分片都会在自己的锁内全量扫描并清理过期条目，开销为 O(n)，
     * 扫描期间该分片上的其他操作会被阻塞；未启用过期时只是累加各分片的大小
     */
    long size();

    void clear();
    long capacity();
    Map<K, V> asMap();
    CacheStats stats();
}
