package com.eventbatch.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A bounded, ordered group of events flushed together.
 *
 * Lifecycle: PENDING -> PROCESSING -> COMPLETED | FAILED.
 * Events can only be appended while the batch is pending and open.
 * Moving to PROCESSING freezes the event list.
 *
 * Not thread-safe on its own; all mutation goes through {@code BatchAccumulator}.
 */
@Getter
public class EventBatch {

    private final String id;
    private final long createdAtMs;
    private final int capacity;

    private List<AnalyticsEvent> events;
    private BatchStatus status = BatchStatus.PENDING;
    private boolean closed;

    private Long startedAtMs;
    private Long completedAtMs;
    private String errorMessage;

    public enum BatchStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED;

        /** Serialized lower-case, e.g. {@code "failed"}. */
        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public EventBatch(String id, long createdAtMs, int capacity) {
        this.id = id;
        this.createdAtMs = createdAtMs;
        this.capacity = capacity;
        this.events = new ArrayList<>();
    }

    public static EventBatch closedOf(String id, long createdAtMs, int capacity, List<AnalyticsEvent> events) {
        if (events.size() > capacity) {
            throw new IllegalArgumentException(
                    "Batch of " + events.size() + " events exceeds capacity " + capacity);
        }
        EventBatch batch = new EventBatch(id, createdAtMs, capacity);
        batch.events.addAll(events);
        batch.closed = true;
        return batch;
    }

    public boolean acceptsEvents() {
        return status == BatchStatus.PENDING && !closed && events.size() < capacity;
    }

    /**
     * Appends an event and closes the batch once it is full.
     *
     * @return true if this append filled the batch
     */
    public boolean append(AnalyticsEvent event) {
        if (!acceptsEvents()) {
            throw new IllegalStateException("Batch " + id + " no longer accepts events");
        }
        events.add(event);
        if (events.size() >= capacity) {
            closed = true;
            return true;
        }
        return false;
    }

    public void close() {
        this.closed = true;
    }

    public boolean isFlushable() {
        return status == BatchStatus.PENDING && closed;
    }

    public int size() {
        return events.size();
    }

    public List<AnalyticsEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public void markProcessing(long nowMs) {
        this.status = BatchStatus.PROCESSING;
        this.closed = true;
        this.events = List.copyOf(events);
        this.startedAtMs = nowMs;
    }

    public void markCompleted(long nowMs) {
        this.status = BatchStatus.COMPLETED;
        this.completedAtMs = nowMs;
    }

    public void markFailed(String error, long nowMs) {
        this.status = BatchStatus.FAILED;
        this.errorMessage = error;
        this.completedAtMs = nowMs;
    }
}
