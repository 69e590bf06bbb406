package com.roapid.sync.job;

import com.roapid.MutableClock;
import com.roapid.adapter.fetch.FetchException;
import com.roapid.common.ConfigurationException;
import com.roapid.domain.JobIdentity;
import com.roapid.domain.ScheduleEntry;
import com.roapid.sync.schedule.IntervalResolver;
import com.roapid.sync.schedule.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobRunnerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final String CATEGORY = "Category:roapid-badges-123";
    private static final JobIdentity BADGE = new JobIdentity("badges", "123");
    private static final IntervalResolver FIVE_MINUTES = type -> Duration.ofMinutes(5);

    @Mock
    private JobExecutor jobExecutor;

    private MutableClock clock;
    private ScheduleStore scheduleStore;
    private JobRunner runner;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduleStore = new ScheduleStore(clock);
        runner = new JobRunner(jobExecutor, scheduleStore, FIVE_MINUTES, clock);
    }

    @Test
    @DisplayName("success schedules the next run one interval after completion")
    void successReschedules() {
        when(jobExecutor.execute(BADGE, CATEGORY)).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(7));
            return new JobOutcome("u", true, true, true);
        });

        assertThat(runner.run(CATEGORY, BADGE)).isTrue();

        ScheduleEntry entry = scheduleStore.get(CATEGORY).orElseThrow();
        assertThat(entry.nextEligibleRun()).isEqualTo(T0.plusSeconds(7).plus(Duration.ofMinutes(5)));
        assertThat(entry.endpointType()).isEqualTo("badges");
    }

    @Test
    @DisplayName("failure leaves the schedule untouched")
    void failureKeepsSchedule() {
        ScheduleEntry due = scheduleStore.upsert(CATEGORY, "badges", T0, FIVE_MINUTES);
        when(jobExecutor.execute(BADGE, CATEGORY)).thenThrow(new FetchException("timeout"));

        assertThat(runner.run(CATEGORY, BADGE)).isFalse();

        assertThat(scheduleStore.get(CATEGORY)).contains(due);
    }

    @Test
    @DisplayName("failure of an unknown job creates no entry")
    void failureCreatesNoEntry() {
        when(jobExecutor.execute(BADGE, CATEGORY)).thenThrow(new ConfigurationException("unknown endpoint type"));

        assertThat(runner.run(CATEGORY, BADGE)).isFalse();
        assertThat(scheduleStore.get(CATEGORY)).isEmpty();
    }

    @Test
    @DisplayName("unexpected runtime exceptions are contained")
    void unexpectedException() {
        when(jobExecutor.execute(BADGE, CATEGORY)).thenThrow(new IllegalStateException("bug"));

        assertThat(runner.run(CATEGORY, BADGE)).isFalse();
        assertThat(runner.run(CATEGORY, BADGE)).isFalse();
        verify(jobExecutor, times(2)).execute(BADGE, CATEGORY);
    }

    @Test
    @DisplayName("a job already in flight is skipped by other callers, whatever label they use")
    void inFlightJobSkipped() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(jobExecutor.execute(BADGE, CATEGORY)).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new JobOutcome("u", false, false, true);
        });
        AtomicBoolean firstResult = new AtomicBoolean();
        Thread first = new Thread(() -> firstResult.set(runner.run(CATEGORY, BADGE)));
        first.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.run(CATEGORY, BADGE)).isFalse();
        assertThat(runner.run("Category:Roapid-badges-123", BADGE)).isFalse();
        assertThat(runner.runIfDue(CATEGORY, BADGE)).isFalse();

        release.countDown();
        first.join(5_000);
        assertThat(firstResult.get()).isTrue();
        verify(jobExecutor, times(1)).execute(BADGE, CATEGORY);
    }

    @Test
    @DisplayName("runIfDue skips a job whose live entry is not due yet")
    void runIfDueSkipsNotDue() {
        ScheduleEntry later = scheduleStore.upsert(CATEGORY, "badges", T0.plusSeconds(60), FIVE_MINUTES);

        assertThat(runner.runIfDue(CATEGORY, BADGE)).isFalse();

        verifyNoInteractions(jobExecutor);
        assertThat(scheduleStore.get(CATEGORY)).contains(later);
    }

    @Test
    @DisplayName("runIfDue runs due and unscheduled jobs")
    void runIfDueRunsDueAndUnknown() {
        scheduleStore.upsert(CATEGORY, "badges", T0, FIVE_MINUTES);
        JobIdentity user = new JobIdentity("users", "9");
        when(jobExecutor.execute(BADGE, CATEGORY)).thenReturn(new JobOutcome("u", true, true, true));
        when(jobExecutor.execute(user, "Category:roapid-users-9")).thenReturn(new JobOutcome("u", true, true, true));

        assertThat(runner.runIfDue(CATEGORY, BADGE)).isTrue();
        assertThat(runner.runIfDue("Category:roapid-users-9", user)).isTrue();

        assertThat(scheduleStore.get(CATEGORY).orElseThrow().nextEligibleRun()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(scheduleStore.get("Category:roapid-users-9")).isPresent();
    }
}
