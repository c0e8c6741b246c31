package com.github.lrucache;

import com.github.lrucache.cache.CacheBuilder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * 分片LRU吞吐量基准（不参与 mvn test）
 * 运行：直接执行 main 方法
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 3, time = 1)
@Fork(1)
public class ShardedLruCacheBenchmark {

    @State(Scope.Benchmark)
    public static class CacheState {
        static final int CAPACITY = 10_000;

        @Param({"1", "16"})
        int concurrencyLevel;

        ShardedLruCache<Integer, String> cache;

        @Setup
        public void setup() {
            cache = CacheBuilder.<Integer, String>newBuilder()
                    .maximumSize(CAPACITY)
                    .concurrencyLevel(concurrencyLevel)
                    .build();
            // 预热一半数据，读操作约50%命中
            for (int i = 0; i < CAPACITY / 2; i++) {
                cache.put(i, "v" + i);
            }
        }
    }

    @Benchmark
    @Threads(8)
    public void read_8t(CacheState s, Blackhole bh) {
        bh.consume(s.cache.get(ThreadLocalRandom.current().nextInt(CacheState.CAPACITY)));
    }

    @Benchmark
    @Threads(8)
    public void write_8t(CacheState s) {
        int key = ThreadLocalRandom.current().nextInt(CacheState.CAPACITY * 2);
        s.cache.put(key, "w");
    }

    @Benchmark
    @Group("mixed")
    @GroupThreads(6)
    public void mixedRead(CacheState s, Blackhole bh) {
        bh.consume(s.cache.get(ThreadLocalRandom.current().nextInt(CacheState.CAPACITY)));
    }

    @Benchmark
    @Group("mixed")
    @GroupThreads(2)
    public void mixedWrite(CacheState s) {
        s.cache.put(ThreadLocalRandom.current().nextInt(CacheState.CAPACITY * 2), "w");
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ShardedLruCacheBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
