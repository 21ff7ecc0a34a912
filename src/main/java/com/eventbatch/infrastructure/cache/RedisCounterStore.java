package com.eventbatch.infrastructure.cache;

import com.eventbatch.domain.port.CounterStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Event counters in Redis, stored as plain JSON numbers.
 *
 * No fallback on the circuit breaker: when Redis is down the aggregator
 * sees the failure and skips that counter.
 */
@Component
@RequiredArgsConstructor
public class RedisCounterStore implements CounterStore {

    private final RedisJsonStore store;

    @Override
    @CircuitBreaker(name = "redis")
    public Optional<Long> get(String key) {
        return store.get(key, Long.class);
    }

    @Override
    @CircuitBreaker(name = "redis")
    public void put(String key, long value, Duration ttl) {
        store.set(key, value, ttl);
    }
}
