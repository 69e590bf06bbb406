package com.roapid.sync.loop;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class WorkTrackerTest {

    @Test
    @DisplayName("closed tracker refuses new work")
    void closedRefusesWork() {
        WorkTracker tracker = new WorkTracker();
        assertThat(tracker.closeAndAwait()).isTrue();

        assertThat(tracker.isClosed()).isTrue();
        assertThat(tracker.tryBegin()).isFalse();
    }

    @Test
    @DisplayName("close waits until running units end")
    void closeWaitsForRunningUnits() throws InterruptedException {
        WorkTracker tracker = new WorkTracker();
        assertThat(tracker.tryBegin()).isTrue();
        AtomicBoolean closed = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);
        Thread closer = new Thread(() -> {
            closed.set(tracker.closeAndAwait());
            done.countDown();
        });
        closer.start();

        assertThat(done.await(200, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(tracker.activeCount()).isEqualTo(1);

        tracker.end();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(closed.get()).isTrue();
    }
}
