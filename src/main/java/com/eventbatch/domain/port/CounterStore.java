package com.eventbatch.domain.port;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key/value store holding per-event-name counters.
 *
 * No atomic increment is offered; callers do read-modify-write.
 */
public interface CounterStore {

    Optional<Long> get(String key);

    void put(String key, long value, Duration ttl);
}
