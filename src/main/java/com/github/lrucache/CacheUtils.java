package com.github.lrucache;

public final class CacheUtils {

    private CacheUtils() {
    }

    /**
     * 扰动函数：降低哈希冲突（参考Caffeine的hash算法）
     * 高16位与低16位异或，并清掉符号位，结果恒为非负
     */
    public static int spread(int h) {
        return (h ^ (h >>> 16)) & 0x7fffffff;
    }

    /**
     * 分片定位：spread(hash) % segmentCount
     * 分片数不要求是2的幂，所以这里用取模而不是位与
     */
    public static int indexFor(Object key, int segmentCount) {
        return spread(key.hashCode()) % segmentCount;
    }

    /**
     * 单分片容量 = ceil(maximumSize / segmentCount)，至少为1
     * 总容量不能整除时，实际总容量会略大于请求值
     *
     * @throws IllegalArgumentException 单分片容量超过 int 范围，无法满足 maximumSize
     */
    public static int segmentCapacity(long maximumSize, int segmentCount) {
        long perSegment = maximumSize / segmentCount + (maximumSize % segmentCount == 0 ? 0 : 1);
        if (perSegment > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maximumSize " + maximumSize
                    + " needs more than Integer.MAX_VALUE entries per segment with concurrencyLevel " + segmentCount);
        }
        return (int) Math.max(1, perSegment);
    }
}
