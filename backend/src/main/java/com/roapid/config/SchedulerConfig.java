package com.roapid.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler pool (3 threads) for the periodic sweeps: category discovery, data refresh, static documents.
 */
@Configuration
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(3);
        s.setThreadNamePrefix("scheduler-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.initialize();
        return s;
    }

    /** Single time source for schedule decisions; replaced in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
