package com.github.lrucache.cache;

/**
 * 缓存条目：key + value + 过期时间 + 访问顺序链表指针
 *
 * 所有字段只在所属分片的锁内读写，因此不需要 volatile / VarHandle
 */
public final class Node<K, V> {

    private final K key;
    private V value;

    // Ticker纳秒时间，仅在启用TTL时有意义
    private long expireAt;

    private Node<K, V> prevInAccessOrder;
    private Node<K, V> nextInAccessOrder;

    public Node(K key, V value, long expireAt) {
        this.key = key;
        this.value = value;
        this.expireAt = expireAt;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public void setValue(V value) {
        this.value = value;
    }

    public void setExpireAt(long expireAt) {
        this.expireAt = expireAt;
    }

    /** 与 System.nanoTime 一样用差值比较，避免数值溢出 */
    public boolean isExpiredAt(long now) {
        return expireAt - now <= 0;
    }

    // 访问顺序链表指针，由 AccessOrderDeque 维护
    public Node<K, V> getPreviousInAccessOrder() { return prevInAccessOrder; }
    public void setPreviousInAccessOrder(Node<K, V> prev) { this.prevInAccessOrder = prev; }

    public Node<K, V> getNextInAccessOrder() { return nextInAccessOrder; }
    public void setNextInAccessOrder(Node<K, V> next) { this.nextInAccessOrder = next; }

    @Override
    public String toString() {
        return "Node{key=" + key + ", value=" + value + '}';
    }
}
