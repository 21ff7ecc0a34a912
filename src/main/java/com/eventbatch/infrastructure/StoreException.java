package com.eventbatch.infrastructure;

/**
 * Failure talking to one of the backing stores.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
