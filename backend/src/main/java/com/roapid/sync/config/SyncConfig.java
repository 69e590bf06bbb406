package com.roapid.sync.config;

import com.roapid.adapter.storage.ArtifactStore;
import com.roapid.sync.bootstrap.BootstrapRecoverer;
import com.roapid.sync.schedule.ScheduleStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Sync engine state: validated intervals, the schedule, and restart recovery.
 */
@Configuration
@EnableConfigurationProperties({
        SyncProperties.class,
        OpenCloudProperties.class,
        StaticDocumentProperties.class,
        WikiModuleProperties.class
})
public class SyncConfig {

    /** Fails startup when a global interval is missing or invalid. */
    @Bean
    public SyncIntervals syncIntervals(SyncProperties properties) {
        return new SyncIntervals(properties);
    }

    @Bean
    public ScheduleStore scheduleStore(Clock clock) {
        return new ScheduleStore(clock);
    }

    @Bean
    public BootstrapRecoverer bootstrapRecoverer(ArtifactStore artifactStore,
                                                 ScheduleStore scheduleStore,
                                                 SyncIntervals syncIntervals,
                                                 Clock clock,
                                                 SyncProperties properties) {
        return new BootstrapRecoverer(artifactStore, scheduleStore, syncIntervals, clock, properties.getCategoryPrefix());
    }
}
