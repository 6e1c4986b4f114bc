package com.yoursp.xerosync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Cron trigger engine for tenant jobs (JobScheduler).
 * A single thread is enough: trigger callbacks only enqueue work.
 */
@Configuration
public class SchedulerConfig {

    @Bean(name = "cronTaskScheduler")
    public ThreadPoolTaskScheduler cronTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cron-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
