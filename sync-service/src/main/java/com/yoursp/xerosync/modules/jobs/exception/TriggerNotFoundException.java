package com.yoursp.xerosync.modules.jobs.exception;

/**
 * Thrown by JobScheduler when no live trigger is registered for a job id.
 */
public class TriggerNotFoundException extends RuntimeException {

    public TriggerNotFoundException(String jobId) {
        super("No trigger registered for job " + jobId);
    }
}
