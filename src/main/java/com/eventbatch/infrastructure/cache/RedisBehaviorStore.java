package com.eventbatch.infrastructure.cache;

import com.eventbatch.domain.model.BehaviorRecord;
import com.eventbatch.domain.port.BehaviorStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Behavior records in Redis under {@code behavior:<userId>}.
 */
@Component
@RequiredArgsConstructor
public class RedisBehaviorStore implements BehaviorStore {

    static final String KEY_PREFIX = "behavior";

    private final RedisJsonStore store;

    @Override
    @CircuitBreaker(name = "redis")
    public Optional<BehaviorRecord> get(String userId) {
        return store.get(store.key(KEY_PREFIX, userId), BehaviorRecord.class);
    }

    @Override
    @CircuitBreaker(name = "redis")
    public void put(String userId, BehaviorRecord record, Duration ttl) {
        store.set(store.key(KEY_PREFIX, userId), record, ttl);
    }
}
