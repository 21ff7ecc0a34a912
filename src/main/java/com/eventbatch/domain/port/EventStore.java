package com.eventbatch.domain.port;

import com.eventbatch.domain.model.AnalyticsEvent;

/**
 * Durable event log.
 */
public interface EventStore {

    /**
     * Inserts one event. Throws on failure; a duplicate id is a failure.
     */
    void insert(AnalyticsEvent event);
}
