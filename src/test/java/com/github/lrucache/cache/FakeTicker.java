package com.github.lrucache.cache;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 手动推进的时间源，测试TTL时不依赖 Thread.sleep
 */
public final class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
        return nanos.get();
    }

    public FakeTicker advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
        return this;
    }
}
