package com.eventbatch.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Point-in-time view of the batch queue.
 *
 * Failed batches stay in {@code batches} until someone deals with them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatusResponse {

    @JsonProperty("isProcessing")
    private boolean processing;

    private int queueLength;
    private long timestamp;
    private List<BatchSummary> batches;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchSummary {
        private String id;
        private int eventCount;
        private EventBatch.BatchStatus status;
        private long createdAt;
        private long ageMs;
        private String errorMessage;

        public static BatchSummary of(EventBatch batch, long nowMs) {
            return BatchSummary.builder()
                    .id(batch.getId())
                    .eventCount(batch.size())
                    .status(batch.getStatus())
                    .createdAt(batch.getCreatedAtMs())
                    .ageMs(nowMs - batch.getCreatedAtMs())
                    .errorMessage(batch.getErrorMessage())
                    .build();
        }
    }
}
