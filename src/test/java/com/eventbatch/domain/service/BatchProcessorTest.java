package com.eventbatch.domain.service;

import com.eventbatch.domain.exception.BatchProcessingException;
import com.eventbatch.domain.model.EventBatch;
import com.eventbatch.domain.model.EventWriteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.eventbatch.domain.service.BatchAccumulatorTest.event;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchProcessorTest {

    @Mock
    private EventPersister eventPersister;

    @Mock
    private MetricsAggregator metricsAggregator;

    @Mock
    private BehaviorTracker behaviorTracker;

    private BatchProcessor batchProcessor;
    private EventBatch batch;

    @BeforeEach
    void setUp() {
        batchProcessor = new BatchProcessor(eventPersister, metricsAggregator, behaviorTracker);
        batch = EventBatch.closedOf("batch_1", 0L, 100, List.of(event(0), event(1)));
    }

    @Test
    void testProcess_PersistsThenAggregates() {
        // Given
        List<EventWriteResult> results = List.of(EventWriteResult.ok("e0"), EventWriteResult.ok("e1"));
        when(eventPersister.persistAll(batch.getEvents())).thenReturn(results);

        // When
        List<EventWriteResult> returned = batchProcessor.process(batch);

        // Then
        assertEquals(results, returned);
        InOrder inOrder = inOrder(eventPersister, metricsAggregator, behaviorTracker);
        inOrder.verify(eventPersister).persistAll(batch.getEvents());
        inOrder.verify(metricsAggregator).aggregate(batch.getEvents());
        inOrder.verify(behaviorTracker).track(List.of(event(0), event(1)));
    }

    @Test
    void testProcess_EscapingErrorFailsBatch() {
        // Given
        when(eventPersister.persistAll(any())).thenReturn(List.of());
        doThrow(new IllegalStateException("unexpected")).when(metricsAggregator).aggregate(any());

        // When
        BatchProcessingException e = assertThrows(BatchProcessingException.class,
                () -> batchProcessor.process(batch));

        // Then
        assertTrue(e.getMessage().contains("batch_1"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        verifyNoInteractions(behaviorTracker);
    }

    @Test
    void testProcess_FailedWriteSkipsBehaviorButStillCounts() {
        // Given - the write for e1 fails
        List<EventWriteResult> results = List.of(
                EventWriteResult.ok("e0"),
                EventWriteResult.failed("e1", new IllegalStateException("duplicate key")));
        when(eventPersister.persistAll(batch.getEvents())).thenReturn(results);

        // When
        batchProcessor.process(batch);

        // Then
        verify(metricsAggregator).aggregate(batch.getEvents());
        verify(behaviorTracker).track(List.of(event(0)));
    }
}
