package com.roapid.sync.loop;

import com.roapid.domain.JobIdentity;
import com.roapid.domain.JobIdentityCodec;
import com.roapid.domain.ScheduleEntry;
import com.roapid.sync.config.SyncProperties;
import com.roapid.sync.job.JobRunner;
import com.roapid.sync.schedule.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Refresh sweep: re-runs every scheduled job whose due time has passed, whether or not it is still listed
 * on the wiki. Works on a snapshot so no lock is held while jobs run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DataRefreshLoop {

    private final ScheduleStore scheduleStore;
    private final JobRunner jobRunner;
    private final SyncProperties syncProperties;
    private final Clock clock;

    /**
     * @return number of jobs that ran successfully
     */
    public int sweep() {
        Map<String, ScheduleEntry> snapshot = scheduleStore.snapshotAll();
        Instant now = clock.instant();
        int due = 0;
        int ran = 0;
        for (Map.Entry<String, ScheduleEntry> e : snapshot.entrySet()) {
            if (!e.getValue().isDueAt(now)) {
                continue;
            }
            Optional<JobIdentity> identity = JobIdentityCodec.tryParse(e.getKey(), syncProperties.getCategoryPrefix());
            if (identity.isEmpty()) {
                log.debug("Skipping scheduled entry with unparseable key {}", e.getKey());
                continue;
            }
            due++;
            if (jobRunner.runIfDue(e.getKey(), identity.get())) {
                ran++;
            }
        }
        if (due > 0) {
            log.info("Data refresh: {}/{} due job(s) synced ({} scheduled)", ran, due, snapshot.size());
        }
        return ran;
    }
}
