package com.github.lrucache.cache;

public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final long expirationCount;

    public CacheStats(long hitCount, long missCount, long evictionCount, long expirationCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.expirationCount = expirationCount;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    /** 没有任何请求时命中率按1.0计算（与Caffeine一致） */
    public double hitRate() {
        long total = requestCount();
        return total == 0 ? 1.0 : (double) hitCount / total;
    }

    public long requestCount() { return hitCount + missCount; }
    public long hitCount() { return hitCount; }
    public long missCount() { return missCount; }
    public long evictionCount() { return evictionCount; }
    public long expirationCount() { return expirationCount; }

    public CacheStats plus(CacheStats other) {
        return new CacheStats(
                hitCount + other.hitCount,
                missCount + other.missCount,
                evictionCount + other.evictionCount,
                expirationCount + other.expirationCount);
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, evicted=%d, expired=%d}",
                hitCount, missCount, evictionCount, expirationCount);
    }
}
