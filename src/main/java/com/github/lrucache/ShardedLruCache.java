package com.github.lrucache;

import com.github.lrucache.cache.Cache;
import com.github.lrucache.cache.CacheBuilder;
import com.github.lrucache.cache.CacheStats;
import com.github.lrucache.cache.LruSegment;
import com.github.lrucache.cache.RemovalListener;
import com.github.lrucache.cache.SegmentStats;
import com.github.lrucache.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 本地缓存核心：分片LRU实现
 * 对应Caffeine的BoundedLocalCache基础结构
 *
 * 每个key按哈希固定路由到一个分片，get/put只锁这一个分片；
 * size/clear/stats 等聚合操作逐个访问分片，任何时刻最多持有一把分片锁。
 */
public class ShardedLruCache<K, V> implements Cache<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(ShardedLruCache.class);

    // 分片数组（final保证可见性）
    private final LruSegment<K, V>[] segments;

    private final long maximumSize;
    private final int segmentCapacity;
    private final Duration expireAfterWrite;

    public ShardedLruCache(long maximumSize) {
        this(maximumSize, null, CacheBuilder.DEFAULT_CONCURRENCY_LEVEL);
    }

    public ShardedLruCache(long maximumSize, Duration expireAfterWrite, int concurrencyLevel) {
        this(maximumSize, expireAfterWrite, concurrencyLevel, Ticker.systemTicker(), null);
    }

    /**
     * @param expireAfterWrite 写入后存活时间，null表示永不过期
     * @param removalListener  可为null
     * @throws IllegalArgumentException 容量、分片数或TTL不是正数，或单分片容量超过 Integer.MAX_VALUE
     */
    @SuppressWarnings("unchecked")
    public ShardedLruCache(long maximumSize, Duration expireAfterWrite, int concurrencyLevel,
                           Ticker ticker, RemovalListener<? super K, ? super V> removalListener) {
        if (maximumSize < 1) {
            throw new IllegalArgumentException("maximumSize must be positive: " + maximumSize);
        }
        if (concurrencyLevel < 1) {
            throw new IllegalArgumentException("concurrencyLevel must be positive: " + concurrencyLevel);
        }
        if (expireAfterWrite != null && (expireAfterWrite.isZero() || expireAfterWrite.isNegative())) {
            throw new IllegalArgumentException("expireAfterWrite must be positive: " + expireAfterWrite);
        }
        Objects.requireNonNull(ticker, "ticker");

        this.maximumSize = maximumSize;
        this.expireAfterWrite = expireAfterWrite;
        this.segmentCapacity = CacheUtils.segmentCapacity(maximumSize, concurrencyLevel);

        long expireAfterWriteNanos = expireAfterWrite == null ? 0L : saturatedToNanos(expireAfterWrite);
        this.segments = new LruSegment[concurrencyLevel];
        for (int i = 0; i < concurrencyLevel; i++) {
            segments[i] = new LruSegment<>(i, segmentCapacity, expireAfterWriteNanos, ticker, removalListener);
        }

        logger.debug("Initialized cache with {} segments, {} entries per segment (requested maximumSize={}, ttl={})",
                concurrencyLevel, segmentCapacity, maximumSize, expireAfterWrite);
    }

    /**
     * 哈希定位：spread(hash) % segmentCount
     * 同一个key在缓存生命周期内始终落到同一个分片
     */
    public int segmentIndex(Object key) {
        return CacheUtils.indexFor(key, segments.length);
    }

    private LruSegment<K, V> segmentFor(K key) {
        return segments[segmentIndex(key)];
    }

    /**
     * 基础操作：直接路由到对应分片
     */
    @Override
    public V get(K key) {
        Objects.requireNonNull(key, "key");
        return segmentFor(key).get(key);
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        segmentFor(key).put(key, value);
    }

    @Override
    public V remove(K key) {
        Objects.requireNonNull(key, "key");
        return segmentFor(key).remove(key);
    }

    @Override
    public boolean contains(K key) {
        Objects.requireNonNull(key, "key");
        return segmentFor(key).contains(key);
    }

    /**
     * 统计所有分片大小（Caffeine的size()也是遍历累加）
     * 各分片依次加锁，结果是近似值；启用TTL时每个分片都要在锁内全量扫描，开销为 O(n)
     */
    @Override
    public long size() {
        long sum = 0;
        for (LruSegment<K, V> segment : segments) {
            sum += segment.size();
        }
        return sum;
    }

    @Override
    public void clear() {
        for (LruSegment<K, V> segment : segments) {
            segment.clear();
        }
    }

    /**
     * 实际总容量 = 单分片容量 * 分片数，可能略大于 maximumSize
     */
    @Override
    public long capacity() {
        return (long) segmentCapacity * segments.length;
    }

    public long maximumSize() {
        return maximumSize;
    }

    public int segmentCapacity() {
        return segmentCapacity;
    }

    public int getSegmentCount() {
        return segments.length;
    }

    public Optional<Duration> expireAfterWrite() {
        return Optional.ofNullable(expireAfterWrite);
    }

    /**
     * 逐分片复制，分片之间不是同一时刻的快照
     */
    @Override
    public Map<K, V> asMap() {
        Map<K, V> copy = new LinkedHashMap<>();
        for (LruSegment<K, V> segment : segments) {
            segment.snapshot(copy);
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public CacheStats stats() {
        CacheStats total = CacheStats.empty();
        for (LruSegment<K, V> segment : segments) {
            total = total.plus(segment.stats().stats());
        }
        return total;
    }

    public List<SegmentStats> segmentStats() {
        List<SegmentStats> result = new ArrayList<>(segments.length);
        for (LruSegment<K, V> segment : segments) {
            result.add(segment.stats());
        }
        return result;
    }

    /**
     * 校验每个分片的 map 与链表是否一致
     */
    public boolean isConsistent() {
        for (LruSegment<K, V> segment : segments) {
            if (!segment.isConsistent()) {
                return false;
            }
        }
        return true;
    }

    private static long saturatedToNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "ShardedLruCache{segments=" + segments.length
                + ", capacity=" + capacity()
                + ", ttl=" + expireAfterWrite + '}';
    }
}
