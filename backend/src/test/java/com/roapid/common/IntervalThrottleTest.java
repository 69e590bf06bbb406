package com.roapid.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntervalThrottleTest {

    @Test
    @DisplayName("first acquire does not wait")
    void firstAcquireIsImmediate() {
        IntervalThrottle throttle = new IntervalThrottle(Duration.ofMinutes(1));
        long start = System.nanoTime();
        throttle.acquire();
        assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(1_000);
    }

    @Test
    @DisplayName("acquire blocks until the window has passed")
    void acquireBlocksThenAllows() {
        IntervalThrottle throttle = new IntervalThrottle(Duration.ofMillis(300));
        throttle.acquire();
        long start = System.nanoTime();
        throttle.acquire();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(250);
    }

    @Test
    @DisplayName("concurrent callers are spaced one window apart")
    void concurrentCallersAreSerialized() throws InterruptedException {
        IntervalThrottle throttle = new IntervalThrottle(Duration.ofMillis(100));
        int threadCount = 4;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger acquired = new AtomicInteger();
        long begin = System.nanoTime();
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    throttle.acquire();
                    acquired.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        long elapsedMs = (System.nanoTime() - begin) / 1_000_000;
        assertThat(acquired.get()).isEqualTo(threadCount);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(250);
    }

    @Test
    @DisplayName("constructor rejects non-positive interval")
    void constructorRejectsNonPositive() {
        assertThatThrownBy(() -> new IntervalThrottle(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }
}
