package com.yoursp.xerosync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors behind the JobQueue.
 */
@Configuration
public class AsyncConfig {

    /** Hosts the single queue worker. */
    @Bean(name = "jobQueueExecutor")
    public ThreadPoolTaskExecutor jobQueueExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("job-queue-");
        executor.initialize();
        return executor;
    }

    /**
     * Runs job bodies so the worker can enforce a deadline and cancel them.
     * One thread: the worker only submits once the previous body has exited.
     */
    @Bean(name = "jobBodyExecutor")
    public ThreadPoolTaskExecutor jobBodyExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("job-body-");
        executor.initialize();
        return executor;
    }
}
