package com.eventbatch.domain.model;

/**
 * Acknowledgement for an accepted batch.
 */
public record BatchReceipt(String batchId, int eventCount) {
}
