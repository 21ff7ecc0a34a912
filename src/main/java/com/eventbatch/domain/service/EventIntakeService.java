package com.eventbatch.domain.service;

import com.eventbatch.domain.exception.ValidationException;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.BatchReceipt;
import com.eventbatch.domain.model.BatchStatusResponse;
import com.eventbatch.domain.model.EventBatch;
import com.eventbatch.domain.model.EventReceipt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for events delivered to the processor.
 *
 * Intake Flow:
 * 1. Validate (event name present, timestamp present)
 * 2. Assign an id when the client sent none
 * 3. Append to the open batch, or enqueue a whole batch
 * 4. Fire the eager trigger when a batch is ready
 *
 * Invalid payloads are rejected with {@link ValidationException} and
 * never reach the queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIntakeService {

    private final BatchAccumulator accumulator;
    private final FlushScheduler flushScheduler;
    private final FlushProcessor flushProcessor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public EventReceipt submitEvent(AnalyticsEvent event) {
        AnalyticsEvent accepted = normalize(validate(event, 0));

        BatchAccumulator.Appended appended = accumulator.append(accepted);
        countReceived(1);

        if (appended.filled()) {
            flushScheduler.triggerEager();
        }
        return new EventReceipt(accepted.getId(), appended.batchId(), appended.filled());
    }

    /**
     * Enqueues the events as one closed batch and triggers a flush.
     *
     * @param events must not be null; a null list means the payload was not an array
     */
    public BatchReceipt submitBatch(List<AnalyticsEvent> events) {
        if (events == null) {
            throw new ValidationException("Events must be an array");
        }
        if (events.size() > accumulator.getCapacity()) {
            throw new ValidationException("Batch of " + events.size()
                    + " events exceeds the maximum of " + accumulator.getCapacity());
        }

        List<AnalyticsEvent> accepted = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            accepted.add(normalize(validate(events.get(i), i)));
        }

        EventBatch batch = accumulator.enqueueClosed(accepted);
        countReceived(accepted.size());
        log.info("Batch {} enqueued with {} events", batch.getId(), accepted.size());

        flushScheduler.triggerEager();
        return new BatchReceipt(batch.getId(), accepted.size());
    }

    public BatchStatusResponse getStatus() {
        List<BatchStatusResponse.BatchSummary> batches = accumulator.summaries();
        return BatchStatusResponse.builder()
                .processing(flushProcessor.isFlushing())
                .queueLength(batches.size())
                .timestamp(clock.millis())
                .batches(batches)
                .build();
    }

    private AnalyticsEvent validate(AnalyticsEvent event, int index) {
        if (event == null) {
            throw new ValidationException("Event " + index + " is missing");
        }
        if (event.getEventName() == null || event.getEventName().isBlank()) {
            throw new ValidationException("Event " + index + ": event name is required");
        }
        if (event.getTimestampMs() == null) {
            throw new ValidationException("Event " + index + ": timestamp is required");
        }
        return event;
    }

    private AnalyticsEvent normalize(AnalyticsEvent event) {
        if (event.getId() != null && !event.getId().isBlank()) {
            return event;
        }
        return event.toBuilder()
                .id("evt_" + UUID.randomUUID())
                .build();
    }

    private void countReceived(int count) {
        Counter.builder("batch.events.received")
                .register(meterRegistry)
                .increment(count);
    }
}
