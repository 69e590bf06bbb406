package com.roapid.sync.bootstrap;

import com.roapid.MutableClock;
import com.roapid.adapter.storage.ArtifactStore;
import com.roapid.adapter.storage.FileArtifactStore;
import com.roapid.adapter.storage.StorageException;
import com.roapid.domain.ScheduleEntry;
import com.roapid.sync.schedule.IntervalResolver;
import com.roapid.sync.schedule.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BootstrapRecovererTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    private static final IntervalResolver TEN_MINUTES = type -> Duration.ofMinutes(10);

    @TempDir
    Path dataDir;

    private MutableClock clock;
    private ScheduleStore scheduleStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        scheduleStore = new ScheduleStore(clock);
    }

    @Test
    @DisplayName("one immediately due entry per matching artifact, none for other files")
    void seedsMatchingArtifacts() throws Exception {
        Files.writeString(dataDir.resolve("badges-123.json"), "{}");
        Files.writeString(dataDir.resolve("places-1-2.json"), "{}");
        Files.writeString(dataDir.resolve("about.json"), "{}");
        Files.writeString(dataDir.resolve("users.json"), "{}");
        Files.writeString(dataDir.resolve("notes.txt"), "x");

        int created = recoverer(new FileArtifactStore(dataDir, clock)).recover();

        assertThat(created).isEqualTo(2);
        assertThat(scheduleStore.snapshotAll()).containsOnlyKeys(
                "Category:roapid-badges-123", "Category:roapid-places-1-2");
        ScheduleEntry badges = scheduleStore.get("Category:roapid-badges-123").orElseThrow();
        assertThat(badges.endpointType()).isEqualTo("badges");
        assertThat(badges.interval()).isEqualTo(Duration.ofMinutes(10));
        assertThat(badges.nextEligibleRun()).isBeforeOrEqualTo(NOW);
        assertThat(badges.isDueAt(clock.instant())).isTrue();
    }

    @Test
    @DisplayName("entries already scheduled are left alone")
    void skipsKnownEntries() throws Exception {
        Files.writeString(dataDir.resolve("badges-123.json"), "{}");
        ScheduleEntry existing = scheduleStore.upsert("Category:roapid-badges-123", "badges", null, TEN_MINUTES);

        int created = recoverer(new FileArtifactStore(dataDir, clock)).recover();

        assertThat(created).isZero();
        assertThat(scheduleStore.get("Category:roapid-badges-123")).contains(existing);
    }

    @Test
    @DisplayName("an entry stored under a differently cased prefix counts as already scheduled")
    void skipsKnownEntryWithOtherPrefixCase() throws Exception {
        Files.writeString(dataDir.resolve("badges-123.json"), "{}");
        ScheduleEntry existing = scheduleStore.upsert("Category:Roapid-badges-123", "badges", null, TEN_MINUTES);

        int created = recoverer(new FileArtifactStore(dataDir, clock)).recover();

        assertThat(created).isZero();
        assertThat(scheduleStore.snapshotAll()).containsOnlyKeys("Category:Roapid-badges-123");
        assertThat(scheduleStore.get("Category:Roapid-badges-123")).contains(existing);
    }

    @Test
    @DisplayName("missing data directory is a fresh install, not an error")
    void missingDirectory() {
        int created = recoverer(new FileArtifactStore(dataDir.resolve("absent"), clock)).recover();

        assertThat(created).isZero();
        assertThat(scheduleStore.size()).isZero();
    }

    @Test
    @DisplayName("read failure aborts recovery without throwing")
    void readFailureAborts() {
        ArtifactStore broken = mock(ArtifactStore.class);
        when(broken.listArtifactNames()).thenThrow(new StorageException("disk on fire"));

        assertThat(recoverer(broken).recover()).isZero();
        assertThat(scheduleStore.size()).isZero();
    }

    private BootstrapRecoverer recoverer(ArtifactStore artifactStore) {
        return new BootstrapRecoverer(artifactStore, scheduleStore, TEN_MINUTES, clock, "roapid");
    }
}
