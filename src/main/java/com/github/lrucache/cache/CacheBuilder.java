package com.github.lrucache.cache;

import com.github.lrucache.ShardedLruCache;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 缓存构建器 - 仿Caffeine.newBuilder()
 *
 * <pre>{@code
 * Cache<String, byte[]> cache = CacheBuilder.<String, byte[]>newBuilder()
 *         .maximumSize(10_000)
 *         .expireAfterWrite(Duration.ofMinutes(5))
 *         .concurrencyLevel(16)
 *         .build();
 * }</pre>
 *
 * 每个选项只能设置一次；非法参数立即抛出 IllegalArgumentException。
 */
public final class CacheBuilder<K, V> {
    static final int UNSET_INT = -1;

    /** 默认分片数 */
    public static final int DEFAULT_CONCURRENCY_LEVEL = 16;

    long maximumSize = UNSET_INT;
    long expireAfterWriteNanos = UNSET_INT;
    int concurrencyLevel = UNSET_INT;
    Ticker ticker;
    RemovalListener<K, V> removalListener;

    private CacheBuilder() {}

    public static <K, V> CacheBuilder<K, V> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * 总容量（必填）。按分片数向上取整分配到各分片
     */
    public CacheBuilder<K, V> maximumSize(long maximumSize) {
        requireState(this.maximumSize == UNSET_INT, "maximumSize was already set to %s", this.maximumSize);
        requireArgument(maximumSize > 0, "maximumSize must be positive: %s", maximumSize);
        this.maximumSize = maximumSize;
        return this;
    }

    public CacheBuilder<K, V> expireAfterWrite(long duration, TimeUnit unit) {
        Objects.requireNonNull(unit, "unit");
        requireState(expireAfterWriteNanos == UNSET_INT,
                "expireAfterWrite was already set to %s ns", expireAfterWriteNanos);
        requireArgument(duration > 0, "duration must be positive: %s %s", duration, unit);
        this.expireAfterWriteNanos = unit.toNanos(duration);
        return this;
    }

    public CacheBuilder<K, V> expireAfterWrite(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        requireArgument(!duration.isZero() && !duration.isNegative(),
                "duration must be positive: %s", duration);
        return expireAfterWrite(saturatedToNanos(duration), TimeUnit.NANOSECONDS);
    }

    /**
     * 分片数，不要求是2的幂
     */
    public CacheBuilder<K, V> concurrencyLevel(int concurrencyLevel) {
        requireState(this.concurrencyLevel == UNSET_INT,
                "concurrencyLevel was already set to %s", this.concurrencyLevel);
        requireArgument(concurrencyLevel > 0, "concurrencyLevel must be positive: %s", concurrencyLevel);
        this.concurrencyLevel = concurrencyLevel;
        return this;
    }

    public CacheBuilder<K, V> ticker(Ticker ticker) {
        requireState(this.ticker == null, "ticker was already set");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        return this;
    }

    /**
     * 配置移除监听器（驱逐、过期、删除、覆盖时触发）
     */
    public CacheBuilder<K, V> removalListener(RemovalListener<K, V> removalListener) {
        requireState(this.removalListener == null, "removalListener was already set");
        this.removalListener = Objects.requireNonNull(removalListener, "removalListener");
        return this;
    }

    public <K1 extends K, V1 extends V> ShardedLruCache<K1, V1> build() {
        requireState(maximumSize != UNSET_INT, "maximumSize is required");
        return new ShardedLruCache<>(
                maximumSize,
                expiresAfterWrite() ? Duration.ofNanos(expireAfterWriteNanos) : null,
                getConcurrencyLevel(),
                getTicker(),
                removalListener);
    }

    boolean expiresAfterWrite() {
        return expireAfterWriteNanos != UNSET_INT;
    }

    int getConcurrencyLevel() {
        return concurrencyLevel == UNSET_INT ? DEFAULT_CONCURRENCY_LEVEL : concurrencyLevel;
    }

    Ticker getTicker() {
        return ticker == null ? Ticker.systemTicker() : ticker;
    }

    private static long saturatedToNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void requireArgument(boolean expression, String template, Object... args) {
        if (!expression) {
            throw new IllegalArgumentException(String.format(template, args));
        }
    }

    private static void requireState(boolean expression, String template, Object... args) {
        if (!expression) {
            throw new IllegalStateException(String.format(template, args));
        }
    }

    @Override
    public String toString() {
        return "CacheBuilder{maximumSize=" + maximumSize
                + ", expireAfterWriteNanos=" + expireAfterWriteNanos
                + ", concurrencyLevel=" + getConcurrencyLevel() + '}';
    }
}
