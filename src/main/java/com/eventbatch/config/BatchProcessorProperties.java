package com.eventbatch.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for batching, flushing and the derived aggregates.
 *
 * Bound from {@code app.batch.*}. Missing values fall back to the defaults
 * the processor has always used (100-event batches, 30 second timer).
 */
@Validated
@ConfigurationProperties(prefix = "app.batch")
public record BatchProcessorProperties(
        @Positive Integer capacity,
        @Positive Long debounceMs,
        @Positive Long flushIntervalMs,
        Duration counterTtl,
        Duration behaviorTtl,
        @Positive Integer behaviorMaxEvents,
        String notificationChannel,
        @Positive Integer writerThreads
) {
    public BatchProcessorProperties {
        if (capacity == null) {
            capacity = 100;
        }
        if (debounceMs == null) {
            debounceMs = 100L;
        }
        if (flushIntervalMs == null) {
            flushIntervalMs = 30_000L;
        }
        if (counterTtl == null) {
            counterTtl = Duration.ofHours(1);
        }
        if (behaviorTtl == null) {
            behaviorTtl = Duration.ofDays(30);
        }
        if (behaviorMaxEvents == null) {
            behaviorMaxEvents = 100;
        }
        if (notificationChannel == null || notificationChannel.isBlank()) {
            notificationChannel = "analytics";
        }
        if (writerThreads == null) {
            writerThreads = 8;
        }
    }

    public static BatchProcessorProperties defaults() {
        return new BatchProcessorProperties(null, null, null, null, null, null, null, null);
    }
}
