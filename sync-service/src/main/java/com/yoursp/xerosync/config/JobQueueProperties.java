package com.yoursp.xerosync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "job-queue")
public class JobQueueProperties {

    /** Pause after each job so the previous run's connections are fully released. */
    private Duration delayBetweenJobs = Duration.ofMillis(500);

    /** Hard deadline for a single job run. */
    private Duration jobTimeout = Duration.ofMinutes(5);

    /** How often the worker re-logs while waiting for a cancelled run to exit. */
    private Duration cancelGracePeriod = Duration.ofSeconds(30);
}
