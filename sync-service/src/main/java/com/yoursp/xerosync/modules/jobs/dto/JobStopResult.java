package com.yoursp.xerosync.modules.jobs.dto;

/**
 * @param triggerRemoved false when the job had no live trigger (e.g. before startup restore ran)
 */
public record JobStopResult(String jobId, String message, boolean triggerRemoved) {
}
