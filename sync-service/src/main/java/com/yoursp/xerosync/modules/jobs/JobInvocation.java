package com.yoursp.xerosync.modules.jobs;

import com.yoursp.xerosync.model.entity.JobType;
import com.yoursp.xerosync.model.entity.ScheduledJob;
import com.yoursp.xerosync.modules.processing.TenantJobProcessor;

import java.util.UUID;

/**
 * A job body bound to the arguments of one registry row. This is what a
 * trigger stores and what the queue runs.
 */
public record JobInvocation(
        String jobId,
        JobType jobType,
        UUID userId,
        String brainId,
        String tenantId,
        TenantJobProcessor processor) implements Runnable {

    public static JobInvocation of(ScheduledJob job, TenantJobProcessor processor) {
        return new JobInvocation(job.getId(), job.getJobType(), job.getUserId(),
                job.getBrainId(), job.getTenantId(), processor);
    }

    /** Label used in logs and the MDC, e.g. "invoice:3f2a...". */
    public String label() {
        return jobType.getValue() + ":" + jobId;
    }

    @Override
    public void run() {
        processor.process(userId, brainId, tenantId);
    }
}
