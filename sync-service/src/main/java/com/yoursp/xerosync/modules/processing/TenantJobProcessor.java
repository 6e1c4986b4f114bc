package com.yoursp.xerosync.modules.processing;

import com.yoursp.xerosync.model.entity.JobType;

import java.util.Map;
import java.util.UUID;

/**
 * Body of a scheduled tenant job: fetch everything available for the tenant
 * and forward it to the brain service as one batch.
 * <p>
 * Implementations handle their own errors and are not safe to run
 * concurrently with each other; JobQueue serializes them.
 * </p>
 */
public interface TenantJobProcessor {

    JobType jobType();

    /**
     * @param userId   owner of the Xero credential used for the run
     * @param brainId  brain the data is forwarded to
     * @param tenantId Xero tenant to read
     * @return the brain service response, or null when there was nothing to send
     *         or the run was skipped
     */
    Map<String, Object> process(UUID userId, String brainId, String tenantId);
}
