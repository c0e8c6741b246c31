package com.github.lrucache.cache;

import com.github.lrucache.ShardedLruCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CacheBuilderTest {

    @Test
    public void testDefaults() {
        ShardedLruCache<String, String> cache = CacheBuilder.<String, String>newBuilder()
                .maximumSize(100)
                .build();

        assertEquals(CacheBuilder.DEFAULT_CONCURRENCY_LEVEL, cache.getSegmentCount());
        assertEquals(100, cache.maximumSize());
        assertTrue(cache.expireAfterWrite().isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    public void testFullConfiguration() {
        FakeTicker ticker = new FakeTicker();
        List<RemovalListener.RemovalCause> causes = new ArrayList<>();

        Cache<String, Integer> cache = CacheBuilder.<String, Integer>newBuilder()
                .maximumSize(10)
                .expireAfterWrite(5, TimeUnit.SECONDS)
                .concurrencyLevel(1)
                .ticker(ticker)
                .removalListener((k, v, cause) -> causes.add(cause))
                .build();

        cache.put("a", 1);
        ticker.advance(Duration.ofSeconds(5));

        assertNull(cache.get("a"));
        assertEquals(List.of(RemovalListener.RemovalCause.EXPIRED), causes);
    }

    @Test
    public void testDurationOverload() {
        ShardedLruCache<String, String> cache = CacheBuilder.<String, String>newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofMinutes(1))
                .build();
        assertEquals(Duration.ofMinutes(1), cache.expireAfterWrite().orElseThrow());
    }

    @Test
    public void testHugeDurationIsSaturated() {
        ShardedLruCache<String, String> cache = CacheBuilder.<String, String>newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofSeconds(Long.MAX_VALUE))
                .build();

        cache.put("k", "v");
        assertEquals("v", cache.get("k"));
    }

    @ParameterizedTest
    @ValueSource(longs = {0, -1, -100})
    public void testRejectsNonPositiveMaximumSize(long size) {
        assertThrows(IllegalArgumentException.class,
                () -> CacheBuilder.newBuilder().maximumSize(size));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    public void testRejectsNonPositiveConcurrencyLevel(int level) {
        assertThrows(IllegalArgumentException.class,
                () -> CacheBuilder.newBuilder().concurrencyLevel(level));
    }

    @Test
    public void testRejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class,
                () -> CacheBuilder.newBuilder().expireAfterWrite(0, TimeUnit.SECONDS));
        assertThrows(IllegalArgumentException.class,
                () -> CacheBuilder.newBuilder().expireAfterWrite(Duration.ofMillis(-5)));
        assertThrows(IllegalArgumentException.class,
                () -> CacheBuilder.newBuilder().expireAfterWrite(Duration.ZERO));
    }

    @Test
    public void testOptionsCanOnlyBeSetOnce() {
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder()
                .maximumSize(10)
                .concurrencyLevel(2)
                .expireAfterWrite(1, TimeUnit.SECONDS);

        assertThrows(IllegalStateException.class, () -> builder.maximumSize(20));
        assertThrows(IllegalStateException.class, () -> builder.concurrencyLevel(4));
        assertThrows(IllegalStateException.class, () -> builder.expireAfterWrite(2, TimeUnit.SECONDS));
    }

    @Test
    public void testMaximumSizeIsRequired() {
        assertThrows(IllegalStateException.class, () -> CacheBuilder.newBuilder().build());
    }

    @Test
    public void testNullArgumentsRejected() {
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().ticker(null));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().removalListener(null));
        assertThrows(NullPointerException.class,
                () -> CacheBuilder.newBuilder().expireAfterWrite(1, null));
    }
}
