package com.github.lrucache.cache;

import com.github.lrucache.cache.RemovalListener.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 缓存分片：HashMap + 访问顺序链表 + 独立的可重入锁 + 独立容量
 *
 * 线程安全策略：
 * - 所有公开方法都在本分片的 ReentrantLock 内执行，只持有这一把锁
 * - 公开方法只调用无锁的私有辅助方法，不会互相嵌套加锁
 * - 移除监听器在解锁之后回调，监听器里再访问缓存也不会死锁
 *
 * 不变式（每次操作完成后）：
 * - map.size() <= capacity
 * - map 中的每个节点都恰好在链表中出现一次，反之亦然
 * - 链表尾部是最近一次 get/put 的节点，头部是下一个驱逐候选
 */
public final class LruSegment<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(LruSegment.class);

    private final int index;
    private final int capacity;
    private final long expireAfterWriteNanos;   // <= 0 表示不过期
    private final Ticker ticker;
    private final RemovalListener<? super K, ? super V> removalListener;

    private final HashMap<K, Node<K, V>> map;
    private final AccessOrderDeque<K, V> deque;
    private final ReentrantLock lock = new ReentrantLock();

    // 统计字段只在锁内修改
    private long hitCount;
    private long missCount;
    private long evictionCount;
    private long expirationCount;

    public LruSegment(int index, int capacity, long expireAfterWriteNanos, Ticker ticker,
                      RemovalListener<? super K, ? super V> removalListener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Segment capacity must be positive: " + capacity);
        }
        this.index = index;
        this.capacity = capacity;
        this.expireAfterWriteNanos = expireAfterWriteNanos;
        this.ticker = ticker;
        this.removalListener = removalListener;
        // 预分配最多1024个槽位，超大容量按需扩容
        this.map = new HashMap<>((Math.min(capacity, 1 << 10) + 1) * 4 / 3 + 1);
        this.deque = new AccessOrderDeque<>();
    }

    /**
     * 命中则移到MRU并返回值；不存在或已过期返回null（计为一次miss）
     */
    public V get(K key) {
        List<Removal<K, V>> removals = newRemovals();
        V value = null;
        lock.lock();
        try {
            Node<K, V> node = map.get(key);
            if (node == null) {
                missCount++;
            } else if (hasExpired(node, now())) {
                // 惰性过期：发现即删除
                expireLocked(node, removals);
                missCount++;
            } else {
                deque.moveToMru(node);
                hitCount++;
                value = node.getValue();
            }
        } finally {
            lock.unlock();
        }
        notifyListener(removals);
        return value;
    }

    /**
     * 写入或更新；新增后若超出容量，驱逐一个LRU节点
     */
    public void put(K key, V value) {
        List<Removal<K, V>> removals = newRemovals();
        lock.lock();
        try {
            long now = now();
            Node<K, V> node = map.get(key);
            if (node != null && hasExpired(node, now)) {
                expireLocked(node, removals);
                node = null;
            }

            if (node != null) {
                record(removals, key, node.getValue(), RemovalCause.REPLACED);
                node.setValue(value);
                node.setExpireAt(expireAtFrom(now));
                deque.moveToMru(node);
                return;
            }

            Node<K, V> created = new Node<>(key, value, expireAtFrom(now));
            map.put(key, created);
            deque.addMru(created);

            // 单次插入最多超出1个，所以最多驱逐一个
            if (map.size() > capacity) {
                evictLocked(now, removals);
            }
        } finally {
            lock.unlock();
            notifyListener(removals);
        }
    }

    /**
     * 显式删除，返回旧值；已过期的条目同样删除，但按不存在处理
     */
    public V remove(K key) {
        List<Removal<K, V>> removals = newRemovals();
        V previous = null;
        lock.lock();
        try {
            Node<K, V> node = map.get(key);
            if (node != null) {
                if (hasExpired(node, now())) {
                    expireLocked(node, removals);
                } else {
                    unlinkLocked(node);
                    previous = node.getValue();
                    record(removals, key, previous, RemovalCause.EXPLICIT);
                }
            }
        } finally {
            lock.unlock();
        }
        notifyListener(removals);
        return previous;
    }

    /**
     * 成员检查：不改变访问顺序，不计入命中统计；
     * 与 get 一样，发现过期条目时直接删除
     */
    public boolean contains(K key) {
        List<Removal<K, V>> removals = newRemovals();
        boolean present = false;
        lock.lock();
        try {
            Node<K, V> node = map.get(key);
            if (node != null) {
                if (hasExpired(node, now())) {
                    expireLocked(node, removals);
                } else {
                    present = true;
                }
            }
        } finally {
            lock.unlock();
        }
        notifyListener(removals);
        return present;
    }

    /**
     * 存活条目数；启用TTL时先清理已过期的条目
     */
    public int size() {
        List<Removal<K, V>> removals = newRemovals();
        int size;
        lock.lock();
        try {
            pruneExpiredLocked(removals);
            size = map.size();
        } finally {
            lock.unlock();
        }
        notifyListener(removals);
        return size;
    }

    /**
     * 清空分片并重置统计
     */
    public void clear() {
        List<Removal<K, V>> removals = newRemovals();
        lock.lock();
        try {
            if (removals != null) {
                long now = now();
                deque.forEach(node -> record(removals, node.getKey(), node.getValue(),
                        hasExpired(node, now) ? RemovalCause.EXPIRED : RemovalCause.EXPLICIT));
            }
            deque.clear();
            map.clear();
            hitCount = 0;
            missCount = 0;
            evictionCount = 0;
            expirationCount = 0;
        } finally {
            lock.unlock();
        }
        notifyListener(removals);
    }

    /**
     * 按LRU→MRU顺序把存活条目复制到sink中
     */
    public void snapshot(Map<? super K, ? super V> sink) {
        lock.lock();
        try {
            long now = now();
            deque.forEach(node -> {
                if (!hasExpired(node, now)) {
                    sink.put(node.getKey(), node.getValue());
                }
            });
        } finally {
            lock.unlock();
        }
    }

    public SegmentStats stats() {
        lock.lock();
        try {
            return new SegmentStats(index, capacity, map.size(),
                    new CacheStats(hitCount, missCount, evictionCount, expirationCount));
        } finally {
            lock.unlock();
        }
    }

    /**
     * map 与链表是否一致（供测试校验不变式）
     */
    public boolean isConsistent() {
        lock.lock();
        try {
            if (map.size() != deque.size() || map.size() > capacity) {
                return false;
            }
            boolean[] consistent = {true};
            deque.forEach(node -> {
                if (map.get(node.getKey()) != node) {
                    consistent[0] = false;
                }
            });
            return consistent[0];
        } finally {
            lock.unlock();
        }
    }

    // ==================== 以下方法必须在持有锁时调用 ====================

    private void evictLocked(long now, List<Removal<K, V>> removals) {
        Node<K, V> victim = deque.pollLru();
        if (victim == null) {
            return;
        }
        map.remove(victim.getKey());
        if (hasExpired(victim, now)) {
            // 被挤出的节点恰好已过期，按过期统计
            expirationCount++;
            record(removals, victim.getKey(), victim.getValue(), RemovalCause.EXPIRED);
            return;
        }
        evictionCount++;
        logger.trace("Segment[{}] evicted key={}", index, victim.getKey());
        record(removals, victim.getKey(), victim.getValue(), RemovalCause.SIZE);
    }

    private void expireLocked(Node<K, V> node, List<Removal<K, V>> removals) {
        unlinkLocked(node);
        expirationCount++;
        logger.trace("Segment[{}] expired key={}", index, node.getKey());
        record(removals, node.getKey(), node.getValue(), RemovalCause.EXPIRED);
    }

    private void unlinkLocked(Node<K, V> node) {
        map.remove(node.getKey());
        deque.remove(node);
    }

    private void pruneExpiredLocked(List<Removal<K, V>> removals) {
        if (!expires()) {
            return;
        }
        // get 只移动位置不刷新过期时间，链表顺序不等于过期顺序，需要全量扫描
        long now = now();
        Iterator<Node<K, V>> iterator = map.values().iterator();
        while (iterator.hasNext()) {
            Node<K, V> node = iterator.next();
            if (node.isExpiredAt(now)) {
                iterator.remove();
                deque.remove(node);
                expirationCount++;
                record(removals, node.getKey(), node.getValue(), RemovalCause.EXPIRED);
            }
        }
    }

    private boolean expires() {
        return expireAfterWriteNanos > 0;
    }

    private boolean hasExpired(Node<K, V> node, long now) {
        return expires() && node.isExpiredAt(now);
    }

    private long now() {
        return expires() ? ticker.read() : 0L;
    }

    private long expireAtFrom(long now) {
        return expires() ? now + expireAfterWriteNanos : 0L;
    }

    // ==================== 移除通知 ====================

    private List<Removal<K, V>> newRemovals() {
        return removalListener == null ? null : new ArrayList<>(2);
    }

    private static <K, V> void record(List<Removal<K, V>> removals, K key, V value, RemovalCause cause) {
        if (removals != null) {
            removals.add(new Removal<>(key, value, cause));
        }
    }

    /**
     * 锁外回调；监听器异常只记录日志，不影响缓存主流程
     */
    private void notifyListener(List<Removal<K, V>> removals) {
        if (removals == null || removals.isEmpty()) {
            return;
        }
        for (Removal<K, V> removal : removals) {
            try {
                removalListener.onRemoval(removal.key(), removal.value(), removal.cause());
            } catch (RuntimeException e) {
                logger.warn("Removal listener failed for key={} cause={}", removal.key(), removal.cause(), e);
            }
        }
    }

    private record Removal<K, V>(K key, V value, RemovalCause cause) {
    }
}
