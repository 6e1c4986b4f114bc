package com.yoursp.xerosync.modules.jobs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Unexpected failure while starting or stopping a job.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class JobOperationException extends RuntimeException {

    public JobOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
