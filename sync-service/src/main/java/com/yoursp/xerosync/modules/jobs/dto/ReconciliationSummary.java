package com.yoursp.xerosync.modules.jobs.dto;

/**
 * Outcome of the startup pass that projects the job registry onto live triggers.
 */
public record ReconciliationSummary(
        int tenantsScanned,
        int tenantsSkipped,
        int jobsCreated,
        int jobsRestored) {
}
