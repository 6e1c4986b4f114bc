package com.yoursp.xerosync.modules.jobs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a job cannot be created because the owning user is not fully
 * configured (e.g. no brain id). Not retried.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class JobConfigurationException extends RuntimeException {

    public JobConfigurationException(String message) {
        super(message);
    }
}
