package com.eventbatch.domain.service;

import com.eventbatch.config.BatchProcessorProperties;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.port.CounterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsAggregatorTest {

    @Mock
    private CounterStore counterStore;

    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new MetricsAggregator(counterStore, BatchProcessorProperties.defaults());
    }

    @Test
    void testAggregate_AddsBatchCountsToExistingCounters() {
        // Given
        when(counterStore.get("metrics:page_view")).thenReturn(Optional.of(40L));
        when(counterStore.get("metrics:signup")).thenReturn(Optional.empty());

        // When
        aggregator.aggregate(List.of(
                named("page_view"), named("signup"), named("page_view"), named("page_view")));

        // Then
        verify(counterStore).put("metrics:page_view", 43L, Duration.ofHours(1));
        verify(counterStore).put("metrics:signup", 1L, Duration.ofHours(1));
        verify(counterStore, times(2)).get(anyString());
    }

    @Test
    void testAggregate_FailedKeyDoesNotStopOthers() {
        // Given
        when(counterStore.get("metrics:page_view")).thenThrow(new IllegalStateException("redis down"));
        when(counterStore.get("metrics:signup")).thenReturn(Optional.of(9L));

        // When
        assertDoesNotThrow(() -> aggregator.aggregate(List.of(named("page_view"), named("signup"))));

        // Then
        verify(counterStore, never()).put(eq("metrics:page_view"), anyLong(), any());
        verify(counterStore).put("metrics:signup", 10L, Duration.ofHours(1));
    }

    @Test
    void testCurrentCount_AbsentIsZero() {
        when(counterStore.get("metrics:purchase")).thenReturn(Optional.empty());

        assertEquals(0L, aggregator.currentCount("purchase"));
    }

    private static AnalyticsEvent named(String name) {
        return AnalyticsEvent.builder()
                .id(name + "-" + System.nanoTime())
                .eventName(name)
                .timestampMs(1_000L)
                .build();
    }
}
