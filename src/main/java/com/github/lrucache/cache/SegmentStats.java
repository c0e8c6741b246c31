package com.github.lrucache.cache;

/**
 * 单个分片的统计快照（在分片锁内读取）
 */
public record SegmentStats(int index, int capacity, int size, CacheStats stats) {

    @Override
    public String toString() {
        return String.format("Segment[%d]{size=%d/%d, %s}", index, size, capacity, stats);
    }
}
