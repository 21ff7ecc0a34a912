package com.eventbatch.domain.service;

import com.eventbatch.domain.exception.BatchProcessingException;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.model.EventBatch;
import com.eventbatch.domain.model.EventWriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Processing routine for one frozen batch.
 *
 * Processing Flow:
 * 1. Persist every event (concurrently, all outcomes collected)
 * 2. Update per-event-name counters (every event, written or not)
 * 3. Append persisted events to per-user behavior windows
 *
 * An event whose write failed never reaches a behavior window, so a
 * replayed duplicate does not show up twice in a user's history.
 *
 * Individual write, counter and behavior failures are handled inside each
 * step. Anything that still escapes is wrapped in
 * {@link BatchProcessingException} and fails the whole batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchProcessor {

    private final EventPersister eventPersister;
    private final MetricsAggregator metricsAggregator;
    private final BehaviorTracker behaviorTracker;

    public List<EventWriteResult> process(EventBatch batch) {
        List<AnalyticsEvent> events = batch.getEvents();
        try {
            List<EventWriteResult> results = eventPersister.persistAll(events);

            metricsAggregator.aggregate(events);
            behaviorTracker.track(persistedOnly(events, results));

            return results;

        } catch (Exception e) {
            throw new BatchProcessingException("Processing failed for batch " + batch.getId(), e);
        }
    }

    private static List<AnalyticsEvent> persistedOnly(List<AnalyticsEvent> events, List<EventWriteResult> results) {
        List<AnalyticsEvent> persisted = new ArrayList<>(events.size());
        for (int i = 0; i < events.size() && i < results.size(); i++) {
            if (results.get(i).success()) {
                persisted.add(events.get(i));
            }
        }
        if (persisted.size() < events.size()) {
            log.debug("Skipping behavior tracking for {} unpersisted events", events.size() - persisted.size());
        }
        return persisted;
    }
}
