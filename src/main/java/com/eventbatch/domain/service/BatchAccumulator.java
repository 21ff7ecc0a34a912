package com.eventbatch.domain.service;

import com.eventbatch.config.BatchProcessorProperties;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.BatchStatusResponse;
import com.eventbatch.domain.model.EventBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns the queue of batches known to this instance.
 *
 * Queue Rules:
 * - At most one open batch accepts appends at a time
 * - A batch closes when it is full, when it was submitted whole,
 *   or when the timer closes it
 * - Only closed PENDING batches are handed to the flush, oldest first
 * - COMPLETED batches are removed, FAILED batches stay
 *
 * Every method takes the same monitor, so intake threads and the flush
 * thread see a consistent queue. A batch handed out by
 * {@link #claimNextPending()} is frozen and no longer touched by intake.
 */
@Slf4j
@Component
public class BatchAccumulator {

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final int capacity;
    private final Clock clock;

    private final List<EventBatch> queue = new ArrayList<>();
    private EventBatch openBatch;

    public BatchAccumulator(BatchProcessorProperties properties, Clock clock) {
        this.capacity = properties.capacity();
        this.clock = clock;
    }

    /**
     * Appends to the open batch, opening a new one if needed.
     *
     * @return the batch the event landed in, and whether this append filled it
     */
    public synchronized Appended append(AnalyticsEvent event) {
        if (openBatch == null || !openBatch.acceptsEvents()) {
            openBatch = new EventBatch(generateBatchId(), clock.millis(), capacity);
            queue.add(openBatch);
            log.debug("Opened batch {}", openBatch.getId());
        }

        EventBatch target = openBatch;
        boolean filled = target.append(event);
        if (filled) {
            log.debug("Batch {} reached capacity ({} events)", target.getId(), capacity);
            openBatch = null;
        }
        return new Appended(target.getId(), filled);
    }

    /**
     * Enqueues a complete batch that never accepts further appends.
     */
    public synchronized EventBatch enqueueClosed(List<AnalyticsEvent> events) {
        EventBatch batch = EventBatch.closedOf(generateBatchId(), clock.millis(), capacity, events);
        queue.add(batch);
        return batch;
    }

    /**
     * Closes the open batch so the next flush pass picks it up.
     *
     * @return true if a non-empty batch was closed
     */
    public synchronized boolean closeOpenBatch() {
        if (openBatch == null || openBatch.size() == 0) {
            return false;
        }
        openBatch.close();
        log.debug("Closed batch {} with {} events", openBatch.getId(), openBatch.size());
        openBatch = null;
        return true;
    }

    /**
     * Marks the oldest flushable batch PROCESSING and returns it.
     */
    public synchronized Optional<EventBatch> claimNextPending() {
        for (EventBatch batch : queue) {
            if (batch.isFlushable()) {
                batch.markProcessing(clock.millis());
                return Optional.of(batch);
            }
        }
        return Optional.empty();
    }

    public synchronized void complete(EventBatch batch) {
        batch.markCompleted(clock.millis());
        queue.remove(batch);
    }

    public synchronized void fail(EventBatch batch, String error) {
        batch.markFailed(error, clock.millis());
    }

    public synchronized boolean hasFlushableBatches() {
        return queue.stream().anyMatch(EventBatch::isFlushable);
    }

    public synchronized int size() {
        return queue.size();
    }

    /**
     * Copy of the queue in FIFO order.
     */
    public synchronized List<EventBatch> snapshot() {
        return List.copyOf(queue);
    }

    /**
     * Summaries built under the lock, so sizes and statuses are consistent.
     */
    public synchronized List<BatchStatusResponse.BatchSummary> summaries() {
        long now = clock.millis();
        return queue.stream()
                .map(batch -> BatchStatusResponse.BatchSummary.of(batch, now))
                .toList();
    }

    public int getCapacity() {
        return capacity;
    }

    public record Appended(String batchId, boolean filled) {
    }

    private String generateBatchId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "batch_" + clock.millis() + "_" + suffix;
    }
}
