package com.github.lrucache.cache;

import java.util.function.Consumer;

/**
 * 访问顺序双端队列 - 模仿Caffeine的LinkedDeque
 * 维护节点从LRU(头)到MRU(尾)的顺序
 *
 * 单个循环哨兵同时充当头尾哨兵：空队列即哨兵自己指向自己，
 * 插入/删除都不需要判空。非线程安全，由所属分片的锁保护。
 */
public final class AccessOrderDeque<K, V> {
    private final Node<K, V> dummy; // 哨兵节点

    public AccessOrderDeque() {
        this.dummy = new Node<>(null, null, 0L);
        dummy.setPreviousInAccessOrder(dummy);
        dummy.setNextInAccessOrder(dummy);
    }

    /** 添加到尾部（MRU位置）- O(1) */
    public void addMru(Node<K, V> e) {
        Node<K, V> prev = dummy.getPreviousInAccessOrder();
        e.setPreviousInAccessOrder(prev);
        e.setNextInAccessOrder(dummy);
        prev.setNextInAccessOrder(e);
        dummy.setPreviousInAccessOrder(e);
    }

    /** 移除并返回头部（LRU位置）- O(1)，空队列返回null */
    public Node<K, V> pollLru() {
        Node<K, V> next = dummy.getNextInAccessOrder();
        if (next == dummy) return null;
        remove(next);
        return next;
    }

    /** 移除指定节点 - O(1) */
    public void remove(Node<K, V> e) {
        Node<K, V> prev = e.getPreviousInAccessOrder();
        Node<K, V> next = e.getNextInAccessOrder();

        if (prev != null) prev.setNextInAccessOrder(next);
        if (next != null) next.setPreviousInAccessOrder(prev);

        // 清理引用帮助GC
        e.setPreviousInAccessOrder(null);
        e.setNextInAccessOrder(null);
    }

    /** 移动到尾部（标记为最近使用）- O(1) */
    public void moveToMru(Node<K, V> e) {
        if (e.getNextInAccessOrder() == dummy) {
            return; // 已经在MRU位置
        }
        remove(e);
        addMru(e);
    }

    /** 查看头部（下一个驱逐候选）不移除 */
    public Node<K, V> peekLru() {
        Node<K, V> next = dummy.getNextInAccessOrder();
        return next == dummy ? null : next;
    }

    /** 查看尾部（MRU）节点 */
    public Node<K, V> peekMru() {
        Node<K, V> prev = dummy.getPreviousInAccessOrder();
        return prev == dummy ? null : prev;
    }

    public boolean isEmpty() {
        return dummy.getNextInAccessOrder() == dummy;
    }

    /** O(n)，只用于一致性校验和统计 */
    public int size() {
        int count = 0;
        Node<K, V> current = dummy.getNextInAccessOrder();
        while (current != dummy) {
            count++;
            current = current.getNextInAccessOrder();
        }
        return count;
    }

    /** 从LRU到MRU遍历 */
    public void forEach(Consumer<Node<K, V>> action) {
        Node<K, V> current = dummy.getNextInAccessOrder();
        while (current != dummy) {
            Node<K, V> next = current.getNextInAccessOrder();
            action.accept(current);
            current = next;
        }
    }

    /** 断开所有节点的链接，只留下哨兵自环 */
    public void clear() {
        Node<K, V> current = dummy.getNextInAccessOrder();
        while (current != dummy) {
            Node<K, V> next = current.getNextInAccessOrder();
            current.setPreviousInAccessOrder(null);
            current.setNextInAccessOrder(null);
            current = next;
        }
        dummy.setPreviousInAccessOrder(dummy);
        dummy.setNextInAccessOrder(dummy);
    }
}
