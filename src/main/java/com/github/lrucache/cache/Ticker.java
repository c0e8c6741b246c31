package com.github.lrucache.cache;

/**
 * 时间源（纳秒）- 对应Caffeine的Ticker
 * 测试中可以注入手动推进的实现，避免依赖 Thread.sleep
 */
@FunctionalInterface
public interface Ticker {

    long read();

    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }
    }
}
