package com.eventbatch.domain.model;

/**
 * Acknowledgement for a single accepted event.
 *
 * {@code batchFull} is set when this event closed its batch.
 */
public record EventReceipt(String eventId, String batchId, boolean batchFull) {
}
