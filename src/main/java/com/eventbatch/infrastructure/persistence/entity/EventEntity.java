package com.eventbatch.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Row in the durable event log.
 *
 * Ids come from the client (or intake), so the entity reports itself as
 * new until it has been persisted or loaded. A second insert with the same
 * id then fails instead of silently updating the first row.
 *
 * Indexing Strategy:
 * - (userId, timestamp) for per-user timelines
 * - timestamp for time-range scans
 * - eventName for filtering by type
 */
@Entity
@Table(name = "analytics_events", indexes = {
    @Index(name = "idx_events_user_timestamp", columnList = "userId,timestamp"),
    @Index(name = "idx_events_timestamp", columnList = "timestamp"),
    @Index(name = "idx_events_name", columnList = "eventName")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventEntity implements Persistable<String> {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String eventName;

    @Column(length = 64)
    private String userId;

    @Column(length = 64)
    private String sessionId;

    @Column(columnDefinition = "TEXT")
    private String properties;

    @Column(columnDefinition = "TEXT")
    private String context;

    @Column(nullable = false)
    private long timestamp;

    @Column(nullable = false)
    private Instant createdAt;

    @Transient
    @Builder.Default
    private boolean stored = false;

    @Override
    public boolean isNew() {
        return !stored;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PostPersist
    @PostLoad
    protected void markStored() {
        this.stored = true;
    }
}
