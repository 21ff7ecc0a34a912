package com.eventbatch.domain.exception;

/**
 * Malformed intake payload. Surfaced to the caller as a 400, never queued.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
