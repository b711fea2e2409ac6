package com.ethval.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimum-interval rate limiter. One instance per class of external API (e.g. Etherscan, DefiLlama);
 * successive calls to the same API are spaced at least {@code minInterval} apart.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(0);

    /**
     * @param minInterval e.g. 300 ms between two calls to the same API
     */
    public RateLimiter(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be zero or positive");
        }
        this.minIntervalNanos = minInterval.toNanos();
    }

    /**
     * @param permitsPerMinute e.g. 30 for 30 requests per minute
     */
    public static RateLimiter perMinute(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        return new RateLimiter(Duration.ofNanos(60_000_000_000L / permitsPerMinute));
    }

    /**
     * Blocks until a permit is available, then returns.
     *
     * @throws IllegalStateException when the waiting thread is interrupted (interrupt flag restored)
     */
    public void acquire() {
        long now;
        long next;
        do {
            now = System.nanoTime();
            next = nextFreeAtNanos.get();
            if (now >= next) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
            } else {
                long sleepNanos = next - now;
                try {
                    Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Rate limiter interrupted", e);
                }
            }
        } while (true);
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
