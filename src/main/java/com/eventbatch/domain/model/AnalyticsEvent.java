package com.eventbatch.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A single analytics event.
 *
 * Immutable once accepted by intake; identity is {@code id}.
 * Older clients send {@code event} and {@code timestamp}, both still accepted.
 * Missing properties and context become empty maps.
 */
@Value
@Builder(toBuilder = true)
public class AnalyticsEvent {

    String id;
    String eventName;
    String userId;
    String sessionId;
    Map<String, Object> properties;
    Map<String, Object> context;
    Long timestampMs;

    @JsonCreator
    public AnalyticsEvent(@JsonProperty("id") String id,
                          @JsonProperty("eventName") @JsonAlias("event") String eventName,
                          @JsonProperty("userId") String userId,
                          @JsonProperty("sessionId") String sessionId,
                          @JsonProperty("properties") Map<String, Object> properties,
                          @JsonProperty("context") Map<String, Object> context,
                          @JsonProperty("timestampMs") @JsonAlias("timestamp") Long timestampMs) {
        this.id = id;
        this.eventName = eventName;
        this.userId = userId;
        this.sessionId = sessionId;
        this.properties = properties != null ? properties : Map.of();
        this.context = context != null ? context : Map.of();
        this.timestampMs = timestampMs;
    }

    public boolean hasUser() {
        return userId != null && !userId.isBlank();
    }
}
