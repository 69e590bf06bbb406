package com.roapid.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimum-spacing throttle: at most one permit per rolling window. Used for wiki edits (1 write/s).
 */
public class IntervalThrottle {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(Long.MIN_VALUE);

    /**
     * @param minInterval e.g. 1s for one write per second
     */
    public IntervalThrottle(Duration minInterval) {
        if (minInterval == null || minInterval.isZero() || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be positive");
        }
        this.minIntervalNanos = minInterval.toNanos();
    }

    /**
     * Blocks until a permit is available, then returns.
     */
    public void acquire() {
        long now;
        long next;
        do {
            now = System.nanoTime();
            next = nextFreeAtNanos.get();
            if (next == Long.MIN_VALUE || now - next >= 0) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
            } else {
                long sleepNanos = next - now;
                try {
                    Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Throttle interrupted", e);
                }
            }
        } while (true);
    }
}
