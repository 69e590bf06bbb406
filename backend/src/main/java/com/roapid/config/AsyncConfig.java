package com.roapid.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named pool for one-off job runs: startup immediate dispatch, the initial discovery sweep, on-demand refreshes.
 * In-flight tasks are allowed to finish on shutdown.
 */
@Configuration
public class AsyncConfig {

    public static final String DISPATCH_EXECUTOR = "dispatch-executor";

    @Bean(name = DISPATCH_EXECUTOR)
    public ThreadPoolTaskExecutor dispatchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("dispatch-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
