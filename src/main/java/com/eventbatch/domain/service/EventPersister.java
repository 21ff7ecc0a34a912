package com.eventbatch.domain.service;

import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.EventWriteResult;
import com.eventbatch.domain.port.EventStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Writes the events of a draining batch to the event log.
 *
 * Every event gets its own write, issued concurrently. All writes are
 * awaited, successful or not, before returning.
 *
 * Why a dedicated write pool?
 * - Bounded concurrency against the database
 * - Insert threads are separate from the request and scheduler pools
 *
 * Failure Handling:
 * - A failed write is logged and reported in its {@link EventWriteResult}
 * - It never fails the batch or cancels sibling writes
 */
@Slf4j
@Service
public class EventPersister {

    private final EventStore eventStore;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public EventPersister(EventStore eventStore,
                          @Qualifier("eventWriteExecutor") Executor executor,
                          MeterRegistry meterRegistry) {
        this.eventStore = eventStore;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return one result per event, in batch order
     */
    public List<EventWriteResult> persistAll(List<AnalyticsEvent> events) {
        List<CompletableFuture<EventWriteResult>> writes = events.stream()
                .map(event -> CompletableFuture
                        .supplyAsync(() -> write(event), executor)
                        .exceptionally(e -> failed(event, e)))
                .toList();

        CompletableFuture.allOf(writes.toArray(CompletableFuture[]::new)).join();

        List<EventWriteResult> results = writes.stream()
                .map(CompletableFuture::join)
                .toList();

        long failures = results.stream().filter(r -> !r.success()).count();
        record("success", results.size() - failures);
        record("error", failures);

        if (failures > 0) {
            log.warn("Persisted {}/{} events ({} failed)",
                    results.size() - failures, results.size(), failures);
        }
        return results;
    }

    private EventWriteResult write(AnalyticsEvent event) {
        eventStore.insert(event);
        return EventWriteResult.ok(event.getId());
    }

    private EventWriteResult failed(AnalyticsEvent event, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("Error persisting event {} ({}): {}", event.getId(), event.getEventName(), cause.getMessage());
        return EventWriteResult.failed(event.getId(), cause);
    }

    private void record(String result, long amount) {
        if (amount == 0) {
            return;
        }
        Counter.builder("batch.events.persisted")
                .tag("result", result)
                .register(meterRegistry)
                .increment(amount);
    }
}
