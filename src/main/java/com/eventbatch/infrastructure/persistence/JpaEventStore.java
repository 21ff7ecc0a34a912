package com.eventbatch.infrastructure.persistence;

import com.eventbatch.domain.model.AnalyticsEvent;
import com.eventbatch.domain.port.EventStore;
import com.eventbatch.infrastructure.StoreException;
import com.eventbatch.infrastructure.persistence.entity.EventEntity;
import com.eventbatch.infrastructure.persistence.repository.EventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Event log backed by the {@code analytics_events} table.
 *
 * Properties and context are stored as JSON text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaEventStore implements EventStore {

    private final EventRepository eventRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void insert(AnalyticsEvent event) {
        EventEntity entity = EventEntity.builder()
                .id(event.getId())
                .eventName(event.getEventName())
                .userId(event.getUserId())
                .sessionId(event.getSessionId())
                .properties(toJson(event.getProperties()))
                .context(toJson(event.getContext()))
                .timestamp(event.getTimestampMs())
                .createdAt(Instant.now())
                .build();

        try {
            eventRepository.save(entity);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to insert event " + event.getId(), e);
        }
        log.debug("Stored event {} ({})", event.getId(), event.getEventName());
    }

    private String toJson(Map<String, Object> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : Map.of());
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize event payload", e);
        }
    }
}
