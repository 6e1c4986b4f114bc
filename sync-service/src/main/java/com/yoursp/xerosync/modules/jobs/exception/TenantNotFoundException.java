package com.yoursp.xerosync.modules.jobs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown when no tenant metadata exists for the (tenant, user) pair, i.e. the
 * user never connected that Xero organisation.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class TenantNotFoundException extends RuntimeException {

    public TenantNotFoundException(String tenantId, UUID userId) {
        super("Tenant metadata not found for tenant " + tenantId + " and user " + userId);
    }
}
