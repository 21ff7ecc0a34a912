package com.eventbatch.domain.exception;

/**
 * Failure of the batch-level processing routine. The only error that marks a batch FAILED.
 */
public class BatchProcessingException extends RuntimeException {

    public BatchProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
