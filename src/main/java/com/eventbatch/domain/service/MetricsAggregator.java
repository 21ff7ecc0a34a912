package com.eventbatch.domain.service;

import com.eventbatch.config.BatchProcessorProperties;
import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.port.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains per-event-name counters in the shared counter store.
 *
 * Update Flow (per distinct event name in the batch):
 * 1. Read current counter (absent = 0)
 * 2. Add the batch's count
 * 3. Write back with a refreshed TTL
 *
 * Known weakness: the read and the write are separate calls. Another
 * instance writing the same key in between loses an update. Accepted for
 * approximate analytics until the store offers an atomic increment.
 */
@Slf4j
@Service
public class MetricsAggregator {

    static final String KEY_PREFIX = "metrics:";

    private final CounterStore counterStore;
    private final Duration ttl;

    public MetricsAggregator(CounterStore counterStore, BatchProcessorProperties properties) {
        this.counterStore = counterStore;
        this.ttl = properties.counterTtl();
    }

    public void aggregate(List<AnalyticsEvent> events) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (AnalyticsEvent event : events) {
            counts.merge(event.getEventName(), 1L, Long::sum);
        }

        counts.forEach(this::increment);
    }

    public long currentCount(String eventName) {
        return counterStore.get(key(eventName)).orElse(0L);
    }

    private void increment(String eventName, long delta) {
        String key = key(eventName);
        try {
            long current = counterStore.get(key).orElse(0L);
            counterStore.put(key, current + delta, ttl);
            log.debug("Counter {} = {} (+{})", key, current + delta, delta);
        } catch (Exception e) {
            log.warn("Error updating counter {}: {}", key, e.getMessage());
        }
    }

    static String key(String eventName) {
        return KEY_PREFIX + eventName;
    }
}
