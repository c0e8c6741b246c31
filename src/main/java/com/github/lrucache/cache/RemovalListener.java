package com.github.lrucache.cache;

/**
 * 移除监听器：在分片锁释放之后、由调用线程同步回调
 */
@FunctionalInterface
public interface RemovalListener<K, V> {
    void onRemoval(K key, V value, RemovalCause cause);

    enum RemovalCause {
        EXPLICIT,   // remove / clear
        REPLACED,   // put 覆盖旧值
        EXPIRED,    // TTL 到期（惰性发现）
        SIZE        // 超出分片容量，LRU 驱逐
    }
}
