package com.eventbatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rolling window of a user's most recent events.
 *
 * Stored as JSON under {@code behavior:<userId>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BehaviorRecord {

    @Builder.Default
    private List<Entry> events = new ArrayList<>();

    private long lastActivityMs;

    public static BehaviorRecord empty() {
        return BehaviorRecord.builder().build();
    }

    /**
     * Appends an entry and evicts the oldest ones beyond {@code maxEvents}.
     */
    public void append(Entry entry, int maxEvents) {
        if (events == null) {
            events = new ArrayList<>();
        }
        events.add(entry);
        if (events.size() > maxEvents) {
            events = new ArrayList<>(events.subList(events.size() - maxEvents, events.size()));
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String eventName;
        private long timestampMs;
        private Map<String, Object> properties;

        public static Entry of(AnalyticsEvent event) {
            return new Entry(event.getEventName(), event.getTimestampMs(), event.getProperties());
        }
    }
}
