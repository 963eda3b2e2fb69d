package com.payerdesk.chatbot.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Broker-backed backend: LPUSH/BRPOP on {@code chat:requests}, responses under {@code chat:response:{id}}.
 */
public class RedisChatQueue implements ChatQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisChatQueue.class);

    static final String REQUESTS_KEY = "chat:requests";
    static final String RESPONSE_PREFIX = "chat:response:";
    static final Duration RESPONSE_TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisChatQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publishRequest(QueuedRequest request) {
        redisTemplate.opsForList().leftPush(REQUESTS_KEY, write(request));
    }

    @Override
    public Optional<QueuedRequest> pollRequest(Duration timeout) {
        String raw = redisTemplate.opsForList().rightPop(REQUESTS_KEY, timeout.toSeconds(), TimeUnit.SECONDS);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, QueuedRequest.class));
        } catch (JsonProcessingException ex) {
            log.warn("Dropping unreadable queued request: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean publishResponse(ResponsePayload payload) {
        Boolean stored = redisTemplate.opsForValue()
                .setIfAbsent(RESPONSE_PREFIX + payload.correlationId(), write(payload), RESPONSE_TTL);
        if (!Boolean.TRUE.equals(stored)) {
            log.warn("Ignoring second response for {}", payload.correlationId());
            return false;
        }
        return true;
    }

    @Override
    public Optional<ResponsePayload> getResponse(String correlationId) {
        String raw = redisTemplate.opsForValue().get(RESPONSE_PREFIX + correlationId);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, ResponsePayload.class));
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable response for {}: {}", correlationId, ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }
}
