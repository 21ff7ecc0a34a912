package com.eventbatch.domain.port;

import com.eventbatch.domain.model.BehaviorRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-user behavior records.
 */
public interface BehaviorStore {

    Optional<BehaviorRecord> get(String userId);

    void put(String userId, BehaviorRecord record, Duration ttl);
}
