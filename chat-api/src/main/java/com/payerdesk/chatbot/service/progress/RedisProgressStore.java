package com.payerdesk.chatbot.service.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Progress shared between API and worker processes through Redis lists under {@code chat:progress:{id}:*}.
 */
public class RedisProgressStore implements ProgressStore {

    private static final Logger log = LoggerFactory.getLogger(RedisProgressStore.class);

    private static final String KEY_PREFIX = "chat:progress:";
    private static final Duration TTL = Duration.ofHours(1);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final int capacity;

    public RedisProgressStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, int capacity) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public void start(String correlationId) {
        redisTemplate.delete(List.of(thinkingKey(correlationId), messageKey(correlationId), eventsKey(correlationId)));
        redisTemplate.opsForValue().set(messageKey(correlationId), "", TTL);
    }

    @Override
    public void appendThinking(String correlationId, String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        redisTemplate.opsForList().rightPush(thinkingKey(correlationId), line.trim());
        redisTemplate.expire(thinkingKey(correlationId), TTL);
        pushEvent(correlationId, ProgressEvent.thinking(line.trim()));
    }

    @Override
    public void appendMessageChunk(String correlationId, String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        redisTemplate.opsForValue().append(messageKey(correlationId), chunk);
        pushEvent(correlationId, ProgressEvent.message(chunk));
    }

    @Override
    public void resetMessage(String correlationId) {
        redisTemplate.opsForValue().set(messageKey(correlationId), "", TTL);
        pushEvent(correlationId, ProgressEvent.messageReset());
    }

    @Override
    public Optional<ProgressSnapshot> snapshot(String correlationId) {
        String message = redisTemplate.opsForValue().get(messageKey(correlationId));
        if (message == null) {
            return Optional.empty();
        }
        List<String> thinking = redisTemplate.opsForList().range(thinkingKey(correlationId), 0, -1);
        return Optional.of(new ProgressSnapshot(thinking, message));
    }

    @Override
    public ProgressBatch eventsSince(String correlationId, long offset) {
        List<String> raw = redisTemplate.opsForList().range(eventsKey(correlationId), offset, -1);
        if (raw == null || raw.isEmpty()) {
            return ProgressBatch.empty(offset);
        }
        List<ProgressEvent> events = new ArrayList<>();
        for (String value : raw) {
            try {
                events.add(objectMapper.readValue(value, ProgressEvent.class));
            } catch (JsonProcessingException ex) {
                log.warn("Skipping unreadable progress event for {}: {}", correlationId, ex.getOriginalMessage());
            }
        }
        return new ProgressBatch(events, offset + raw.size());
    }

    @Override
    public void clear(String correlationId) {
        redisTemplate.delete(List.of(thinkingKey(correlationId), messageKey(correlationId), eventsKey(correlationId)));
    }

    private void pushEvent(String correlationId, ProgressEvent event) {
        String key = eventsKey(correlationId);
        Long size = redisTemplate.opsForList().size(key);
        if (size != null && size >= capacity) {
            return;
        }
        try {
            redisTemplate.opsForList().rightPush(key, objectMapper.writeValueAsString(event));
            redisTemplate.expire(key, TTL);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize progress event for {}: {}", correlationId, ex.getOriginalMessage());
        }
    }

    private static String thinkingKey(String correlationId) {
        return KEY_PREFIX + correlationId + ":thinking";
    }

    private static String messageKey(String correlationId) {
        return KEY_PREFIX + correlationId + ":message";
    }

    private static String eventsKey(String correlationId) {
        return KEY_PREFIX + correlationId + ":events";
    }
}
