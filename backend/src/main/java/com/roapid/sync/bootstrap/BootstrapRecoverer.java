package com.roapid.sync.bootstrap;

import com.roapid.adapter.storage.ArtifactStore;
import com.roapid.adapter.storage.StorageException;
import com.roapid.domain.JobIdentity;
import com.roapid.domain.JobIdentityCodec;
import com.roapid.sync.schedule.IntervalResolver;
import com.roapid.sync.schedule.ScheduleStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Re-seeds the schedule from artifacts left by earlier runs so known jobs survive a restart.
 * Recovered jobs are due immediately.
 */
@Slf4j
public class BootstrapRecoverer {

    private final ArtifactStore artifactStore;
    private final ScheduleStore scheduleStore;
    private final IntervalResolver intervalResolver;
    private final Clock clock;
    private final String categoryPrefix;

    public BootstrapRecoverer(ArtifactStore artifactStore,
                              ScheduleStore scheduleStore,
                              IntervalResolver intervalResolver,
                              Clock clock,
                              String categoryPrefix) {
        this.artifactStore = artifactStore;
        this.scheduleStore = scheduleStore;
        this.intervalResolver = intervalResolver;
        this.clock = clock;
        this.categoryPrefix = categoryPrefix;
    }

    /**
     * @return number of entries created
     */
    public int recover() {
        List<String> names;
        try {
            names = artifactStore.listArtifactNames();
        } catch (StorageException e) {
            log.error("bootstrap: cannot read data directory, skipping recovery: {}", e.getMessage());
            return 0;
        }
        if (names.isEmpty()) {
            log.debug("bootstrap: no artifacts found; nothing to schedule yet");
            return 0;
        }

        Instant now = clock.instant();
        int count = 0;
        for (String name : names) {
            Optional<JobIdentity> identity = JobIdentityCodec.fromArtifactName(name);
            if (identity.isEmpty()) {
                continue;
            }
            String category = JobIdentityCodec.render(identity.get(), categoryPrefix);
            if (scheduleStore.findKey(category, JobIdentityCodec.sameJob(identity.get(), categoryPrefix)).isPresent()) {
                continue;
            }
            log.debug("bootstrap: scheduling {} from {}", category, name);
            scheduleStore.upsert(category, identity.get().endpointType(), now, intervalResolver);
            count++;
        }
        log.info("bootstrap: scheduled {} endpoint(s) from existing data files", count);
        return count;
    }
}
