package com.yoursp.xerosync.modules.processing;

/**
 * Thrown when the brain service rejects a batch or cannot be reached.
 */
public class BrainApiUnavailableException extends RuntimeException {

    public BrainApiUnavailableException(String message) {
        super(message);
    }

    public BrainApiUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
