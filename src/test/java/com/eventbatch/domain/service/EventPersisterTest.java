package com.eventbatch.domain.service;

import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.EventWriteResult;
import com.eventbatch.domain.port.EventStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.eventbatch.domain.service.BatchAccumulatorTest.event;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventPersisterTest {

    @Mock
    private EventStore eventStore;

    private MeterRegistry meterRegistry;
    private EventPersister persister;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        // Same-thread executor keeps the call order observable
        persister = new EventPersister(eventStore, Runnable::run, meterRegistry);
    }

    @Test
    void testPersistAll_WritesInBatchOrder() {
        // Given
        List<AnalyticsEvent> events = List.of(event(1), event(2), event(3), event(4), event(5));

        // When
        List<EventWriteResult> results = persister.persistAll(events);

        // Then
        InOrder inOrder = inOrder(eventStore);
        for (AnalyticsEvent event : events) {
            inOrder.verify(eventStore).insert(event);
        }
        assertEquals(List.of("e1", "e2", "e3", "e4", "e5"),
                results.stream().map(EventWriteResult::eventId).toList());
        assertTrue(results.stream().allMatch(EventWriteResult::success));
    }

    @Test
    void testPersistAll_OneFailureDoesNotStopSiblings() {
        // Given
        List<AnalyticsEvent> events = List.of(event(1), event(2), event(3), event(4), event(5));
        failOn("e3", "duplicate key");

        // When
        List<EventWriteResult> results = persister.persistAll(events);

        // Then
        verify(eventStore, times(5)).insert(any());
        assertEquals(5, results.size());
        assertFalse(results.get(2).success());
        assertEquals("duplicate key", results.get(2).error());
        assertEquals(List.of("e1", "e2", "e4", "e5"), results.stream()
                .filter(EventWriteResult::success)
                .map(EventWriteResult::eventId)
                .toList());

        assertEquals(4.0, meterRegistry.get("batch.events.persisted").tag("result", "success").counter().count());
        assertEquals(1.0, meterRegistry.get("batch.events.persisted").tag("result", "error").counter().count());
    }

    @Test
    void testPersistAll_ConcurrentWritesAllObserved() {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(4);
        EventPersister concurrent = new EventPersister(eventStore, pool, meterRegistry);
        List<AnalyticsEvent> events = List.of(event(1), event(2), event(3), event(4), event(5));
        failOn("e1", "timeout");

        try {
            // When
            List<EventWriteResult> results = concurrent.persistAll(events);

            // Then
            assertEquals(List.of("e1", "e2", "e3", "e4", "e5"),
                    results.stream().map(EventWriteResult::eventId).toList());
            assertEquals(1, results.stream().filter(r -> !r.success()).count());
            verify(eventStore, times(5)).insert(any());
        } finally {
            pool.shutdownNow();
        }
    }

    private void failOn(String eventId, String message) {
        doAnswer(invocation -> {
            AnalyticsEvent event = invocation.getArgument(0);
            if (event.getId().equals(eventId)) {
                throw new IllegalStateException(message);
            }
            return null;
        }).when(eventStore).insert(any());
    }

    @Test
    void testPersistAll_EmptyBatch() {
        assertTrue(persister.persistAll(List.of()).isEmpty());
        verifyNoInteractions(eventStore);
    }
}
