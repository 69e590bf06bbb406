package com.roapid.sync.loop;

import com.roapid.adapter.wiki.WikiClient;
import com.roapid.adapter.wiki.WikiException;
import com.roapid.domain.InvalidCategoryException;
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
import java.util.List;
import java.util.Optional;

/**
 * Discovery sweep: reconciles the wiki's category listing with the schedule.
 * Unknown jobs run at once, known jobs only when due.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CategoryDiscoveryLoop {

    private final WikiClient wikiClient;
    private final ScheduleStore scheduleStore;
    private final JobRunner jobRunner;
    private final SyncProperties syncProperties;
    private final Clock clock;

    /**
     * @return number of jobs that ran successfully
     */
    public int sweep() {
        String prefix = syncProperties.getCategoryPrefix();
        List<String> categories;
        try {
            categories = wikiClient.categoriesWithPrefix(prefix);
        } catch (WikiException e) {
            log.warn("Category check failed, retrying next sweep: {}", e.getMessage());
            return 0;
        }
        log.info("Category check: {} categor(ies) with prefix {}", categories.size(), prefix);

        int ran = 0;
        for (String label : categories) {
            JobIdentity identity;
            try {
                identity = JobIdentityCodec.parse(label, prefix);
            } catch (InvalidCategoryException e) {
                log.debug("Skipping {}: {}", label, e.getMessage());
                continue;
            }
            // an entry recovered at startup may spell the prefix differently
            String category = scheduleStore.findKey(label, JobIdentityCodec.sameJob(identity, prefix)).orElse(label);

            Optional<ScheduleEntry> entry = scheduleStore.get(category);
            if (entry.isPresent() && !entry.get().isDueAt(clock.instant())) {
                log.debug("{} not due until {}", category, entry.get().nextEligibleRun());
                continue;
            }
            if (entry.isEmpty()) {
                log.info("New job discovered: {}", category);
            }
            if (jobRunner.runIfDue(category, identity)) {
                ran++;
            }
        }
        return ran;
    }
}
