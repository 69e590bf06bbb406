package com.roapid.sync.job;

import com.roapid.common.RoapidException;
import com.roapid.domain.JobIdentity;
import com.roapid.domain.ScheduleEntry;
import com.roapid.sync.schedule.IntervalResolver;
import com.roapid.sync.schedule.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single entry point for running a job from any loop or trigger. Skips a job that is already running,
 * reschedules it on success and leaves the schedule untouched on failure. The in-flight guard is keyed on
 * the job identity, so differently spelled labels for one job never run side by side.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobRunner {

    private final Set<String> inFlightJobs = ConcurrentHashMap.newKeySet();

    private final JobExecutor jobExecutor;
    private final ScheduleStore scheduleStore;
    private final IntervalResolver intervalResolver;
    private final Clock clock;

    /**
     * Runs the job regardless of its schedule.
     *
     * @return true when the job ran and was rescheduled
     */
    public boolean run(String category, JobIdentity identity) {
        return runGuarded(category, identity, false);
    }

    /**
     * Runs the job unless its live schedule entry exists and is not yet due. The entry is re-read after the
     * in-flight slot is taken, so a run finished by another caller since the sweep started is not repeated.
     *
     * @return true when the job ran and was rescheduled
     */
    public boolean runIfDue(String category, JobIdentity identity) {
        return runGuarded(category, identity, true);
    }

    private boolean runGuarded(String category, JobIdentity identity, boolean onlyIfDue) {
        String key = identity.artifactName();
        if (!inFlightJobs.add(key)) {
            log.debug("Skipping {}: already in-flight", category);
            return false;
        }
        try {
            if (onlyIfDue) {
                Optional<ScheduleEntry> live = scheduleStore.get(category);
                if (live.isPresent() && !live.get().isDueAt(clock.instant())) {
                    log.debug("Skipping {}: no longer due (next run {})", category, live.get().nextEligibleRun());
                    return false;
                }
            }
            JobOutcome outcome = jobExecutor.execute(identity, category);
            scheduleStore.upsert(category, identity.endpointType(), null, intervalResolver);
            log.debug("Synced {} (changed={}, published={})", category, outcome.changed(), outcome.published());
            return true;
        } catch (RoapidException e) {
            logFailure(category, e);
            return false;
        } catch (RuntimeException e) {
            log.warn("Job {} failed unexpectedly", category, e);
            return false;
        } finally {
            inFlightJobs.remove(key);
        }
    }

    private static void logFailure(String category, RoapidException e) {
        switch (e.getKind().getDisposition()) {
            case SKIP -> log.debug("Skipping {}: {}", category, e.getMessage());
            case LOG_ONLY -> log.info("{}: {}", category, e.getMessage());
            default -> log.warn("Job {} failed ({}), will retry next sweep: {}", category, e.getKind(), e.getMessage());
        }
    }
}
