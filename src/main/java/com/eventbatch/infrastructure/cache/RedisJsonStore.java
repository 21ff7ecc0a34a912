package com.eventbatch.infrastructure.cache;

import com.eventbatch.infrastructure.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * JSON values in Redis with a TTL on every write.
 *
 * Shared by the counter and behavior stores. Unlike a read-through cache,
 * errors are not swallowed here: a failed read must not be mistaken for a
 * missing key, or the next write would reset the value.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisJsonStore {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            String stored = redisTemplate.opsForValue().get(key);

            if (stored == null) {
                log.debug("No value for key: {}", key);
                return Optional.empty();
            }

            return Optional.of(objectMapper.readValue(stored, type));

        } catch (Exception e) {
            throw new StoreException("Error reading key " + key, e);
        }
    }

    public void set(String key, Object value, Duration ttl) {
        try {
            String json = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key, json, ttl.toSeconds(), TimeUnit.SECONDS);
            log.debug("Stored key: {} (TTL: {}s)", key, ttl.toSeconds());

        } catch (Exception e) {
            throw new StoreException("Error writing key " + key, e);
        }
    }

    /**
     * Builds a key from a prefix and parts, e.g. {@code behavior:user-1}.
     */
    public String key(String prefix, Object... parts) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object part : parts) {
            key.append(":").append(part != null ? part.toString() : "null");
        }
        return key.toString();
    }
}
