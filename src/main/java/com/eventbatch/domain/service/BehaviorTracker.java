package com.eventbatch.domain.service;

import com.eventbatch.config.BatchProcessorProperties;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.BehaviorRecord;
import com.eventbatch.domain.port.BehaviorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Appends events to each user's rolling behavior window.
 *
 * Events are applied one at a time in batch order, so several events for
 * the same user in one batch all land in the record.
 */
@Slf4j
@Service
public class BehaviorTracker {

    private final BehaviorStore behaviorStore;
    private final Duration ttl;
    private final int maxEvents;

    public BehaviorTracker(BehaviorStore behaviorStore, BatchProcessorProperties properties) {
        this.behaviorStore = behaviorStore;
        this.ttl = properties.behaviorTtl();
        this.maxEvents = properties.behaviorMaxEvents();
    }

    public void track(List<AnalyticsEvent> events) {
        for (AnalyticsEvent event : events) {
            if (event.hasUser()) {
                track(event);
            }
        }
    }

    public Optional<BehaviorRecord> find(String userId) {
        return behaviorStore.get(userId);
    }

    private void track(AnalyticsEvent event) {
        try {
            BehaviorRecord record = behaviorStore.get(event.getUserId()).orElseGet(BehaviorRecord::empty);
            record.append(BehaviorRecord.Entry.of(event), maxEvents);
            record.setLastActivityMs(event.getTimestampMs());
            behaviorStore.put(event.getUserId(), record, ttl);
        } catch (Exception e) {
            log.warn("Error updating behavior for user {}: {}", event.getUserId(), e.getMessage());
        }
    }
}
