package com.eventbatch.infrastructure.notification;

import com.eventbatch.domain.port.RealtimeNotifier;
import com.eventbatch.infrastructure.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Publishes realtime messages on a Redis pub/sub channel.
 *
 * Subscribers (dashboard websocket gateways) receive the message as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisRealtimeNotifier implements RealtimeNotifier {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    @CircuitBreaker(name = "redis")
    public void broadcast(String channel, Map<String, Object> message) {
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize message for channel " + channel, e);
        }

        redisTemplate.convertAndSend(channel, json);
        log.debug("Published to {}: {}", channel, json);
    }
}
