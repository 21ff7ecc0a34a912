package com.eventbatch.domain.service;

import com.eventbatch.config.BatchProcessorProperties;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.BehaviorRecord;
import com.eventbatch.domain.port.BehaviorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uses an in-memory store so the read-modify-write sequence is exercised for real.
 */
class BehaviorTrackerTest {

    private InMemoryBehaviorStore store;
    private BehaviorTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryBehaviorStore();
        tracker = new BehaviorTracker(store, BatchProcessorProperties.defaults());
    }

    @Test
    void testTrack_KeepsMostRecentHundred() {
        // Given
        List<AnalyticsEvent> events = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            events.add(userEvent("user-1", i));
        }

        // When
        tracker.track(events);

        // Then
        BehaviorRecord record = store.get("user-1").orElseThrow();
        assertEquals(100, record.getEvents().size());
        assertEquals(10_050L, record.getEvents().get(0).getTimestampMs());
        assertEquals(10_149L, record.getEvents().get(99).getTimestampMs());
        assertEquals(10_149L, record.getLastActivityMs());
        assertEquals(Duration.ofDays(30), store.lastTtl);
    }

    @Test
    void testTrack_AppendsAcrossBatches() {
        tracker.track(List.of(userEvent("user-1", 0)));
        tracker.track(List.of(userEvent("user-1", 1), userEvent("user-2", 2)));

        assertEquals(2, store.get("user-1").orElseThrow().getEvents().size());
        assertEquals(1, store.get("user-2").orElseThrow().getEvents().size());
    }

    @Test
    void testTrack_StoresEventSummary() {
        AnalyticsEvent event = userEvent("user-1", 7).toBuilder()
                .properties(Map.of("page", "/pricing"))
                .build();

        tracker.track(List.of(event));

        BehaviorRecord.Entry entry = store.get("user-1").orElseThrow().getEvents().get(0);
        assertEquals("page_view", entry.getEventName());
        assertEquals(10_007L, entry.getTimestampMs());
        assertEquals("/pricing", entry.getProperties().get("page"));
    }

    @Test
    void testTrack_SkipsAnonymousEvents() {
        AnalyticsEvent anonymous = AnalyticsEvent.builder()
                .id("anon")
                .eventName("page_view")
                .timestampMs(1L)
                .build();

        tracker.track(List.of(anonymous));

        assertTrue(store.records.isEmpty());
    }

    @Test
    void testTrack_StoreFailureIsNotFatal() {
        store.failWrites = true;

        assertDoesNotThrow(() -> tracker.track(List.of(userEvent("user-1", 0), userEvent("user-2", 1))));
        assertEquals(2, store.writeAttempts);
    }

    private static AnalyticsEvent userEvent(String userId, int i) {
        return AnalyticsEvent.builder()
                .id(userId + "-" + i)
                .eventName("page_view")
                .userId(userId)
                .timestampMs(10_000L + i)
                .build();
    }

    static class InMemoryBehaviorStore implements BehaviorStore {
        final Map<String, BehaviorRecord> records = new HashMap<>();
        Duration lastTtl;
        boolean failWrites;
        int writeAttempts;

        @Override
        public Optional<BehaviorRecord> get(String userId) {
            return Optional.ofNullable(records.get(userId));
        }

        @Override
        public void put(String userId, BehaviorRecord record, Duration ttl) {
            writeAttempts++;
            if (failWrites) {
                throw new IllegalStateException("behavior store unavailable");
            }
            records.put(userId, record);
            lastTtl = ttl;
        }
    }
}
