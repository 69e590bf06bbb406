package com.roapid.sync.schedule;

import com.roapid.MutableClock;
import com.roapid.domain.ScheduleEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    private static final String KEY = "Category:roapid-badges-123";

    private MutableClock clock;
    private ScheduleStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new ScheduleStore(clock);
    }

    @Test
    @DisplayName("first upsert takes the resolver interval and schedules now + interval")
    void firstUpsertUsesResolver() {
        ScheduleEntry entry = store.upsert(KEY, "badges", null, type -> Duration.ofMinutes(10));

        assertThat(entry.endpointType()).isEqualTo("badges");
        assertThat(entry.interval()).isEqualTo(Duration.ofMinutes(10));
        assertThat(entry.nextEligibleRun()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        assertThat(store.get(KEY)).contains(entry);
    }

    @Test
    @DisplayName("second upsert is strictly later and keeps the same interval")
    void secondUpsertIsLater() {
        ScheduleEntry first = store.upsert(KEY, "badges", null, type -> Duration.ofMinutes(5));
        clock.advance(Duration.ofSeconds(1));
        ScheduleEntry second = store.upsert(KEY, "badges", null, type -> Duration.ofMinutes(5));

        assertThat(second.nextEligibleRun()).isAfter(first.nextEligibleRun());
        assertThat(second.interval()).isEqualTo(first.interval());
    }

    @Test
    @DisplayName("established interval is sticky even if the resolver changes")
    void establishedIntervalIsSticky() {
        store.upsert(KEY, "badges", null, type -> Duration.ofMinutes(5));
        ScheduleEntry updated = store.upsert(KEY, "badges", null, type -> Duration.ofHours(2));

        assertThat(updated.interval()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("non-positive or failing resolver falls back to one minute")
    void fallbackInterval() {
        assertThat(store.upsert("a", "t", null, type -> Duration.ZERO).interval())
                .isEqualTo(ScheduleStore.FALLBACK_INTERVAL);
        assertThat(store.upsert("b", "t", null, type -> null).interval())
                .isEqualTo(Duration.ofMinutes(1));
        assertThat(store.upsert("c", "t", null, type -> {
            throw new IllegalStateException("boom");
        }).interval()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("explicit next run is used verbatim for a new entry")
    void explicitNextRun() {
        ScheduleEntry entry = store.upsert(KEY, "badges", T0, type -> Duration.ofMinutes(5));

        assertThat(entry.nextEligibleRun()).isEqualTo(T0);
        assertThat(entry.isDueAt(clock.instant())).isTrue();
    }

    @Test
    @DisplayName("due time never moves backwards")
    void neverRewinds() {
        store.upsert(KEY, "badges", null, type -> Duration.ofMinutes(5));
        ScheduleEntry rewound = store.upsert(KEY, "badges", T0.minusSeconds(60), type -> Duration.ofMinutes(5));

        assertThat(rewound.nextEligibleRun()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("snapshot is a copy unaffected by later upserts")
    void snapshotIsCopy() {
        store.upsert(KEY, "badges", null, type -> Duration.ofMinutes(5));
        Map<String, ScheduleEntry> snapshot = store.snapshotAll();
        store.upsert("Category:roapid-users-1", "users", null, type -> Duration.ofMinutes(5));

        assertThat(snapshot).containsOnlyKeys(KEY);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("concurrent upserts of many keys leave one entry per key with a positive interval")
    void concurrentUpserts() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(800);
        for (int i = 0; i < 800; i++) {
            String key = "Category:roapid-badges-" + (i % 100);
            pool.execute(() -> {
                try {
                    store.upsert(key, "badges", null, type -> Duration.ofSeconds(30));
                } finally {
                    done.countDown();
                }
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        assertThat(store.size()).isEqualTo(100);
        assertThat(store.snapshotAll().values())
                .allSatisfy(e -> assertThat(e.interval()).isEqualTo(Duration.ofSeconds(30)));
    }
}
