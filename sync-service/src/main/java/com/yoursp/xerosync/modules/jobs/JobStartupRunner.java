package com.yoursp.xerosync.modules.jobs;

import com.yoursp.xerosync.config.ScheduleProperties;
import com.yoursp.xerosync.modules.jobs.dto.ReconciliationSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Restores tenant job triggers once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobStartupRunner {

    private final JobManager jobManager;
    private final ScheduleProperties scheduleProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void restoreJobs() {
        if (!scheduleProperties.isRestoreOnStartup()) {
            log.info("Job restore on startup disabled (schedule.restore-on-startup=false)");
            return;
        }
        try {
            ReconciliationSummary summary = jobManager.startJobsOnStartup();
            log.info("Startup job reconciliation done: tenants={}, skipped={}, created={}, restored={}",
                    summary.tenantsScanned(), summary.tenantsSkipped(),
                    summary.jobsCreated(), summary.jobsRestored());
        } catch (RuntimeException e) {
            // Jobs come back on the next restart; the service itself stays up
            log.error("Error starting jobs on startup: {}", e.getMessage(), e);
        }
    }
}
