package com.yoursp.xerosync.modules.token.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Thrown when an operation needs the user's stored Xero credential and there is none.
 */
@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException(UUID userId) {
        super("No valid Xero token found for user " + userId);
    }
}
