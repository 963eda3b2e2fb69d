package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Plans shared between worker and API processes under {@code chat:plan:{id}}, expiring with the response.
 */
public class RedisPlanStore implements PlanStore {

    private static final Logger log = LoggerFactory.getLogger(RedisPlanStore.class);

    static final String KEY_PREFIX = "chat:plan:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisPlanStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public void store(String correlationId, Plan plan) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + correlationId, objectMapper.writeValueAsString(plan), ttl);
        } catch (JsonProcessingException ex) {
            log.warn("Could not serialize plan for {}: {}", correlationId, ex.getOriginalMessage());
        } catch (DataAccessException ex) {
            log.warn("Dropped plan for {}: {}", correlationId, ex.getMessage());
        }
    }

    @Override
    public Optional<Plan> find(String correlationId) {
        try {
            String raw = redisTemplate.opsForValue().get(KEY_PREFIX + correlationId);
            if (raw == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(raw, Plan.class));
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable plan for {}: {}", correlationId, ex.getOriginalMessage());
            return Optional.empty();
        } catch (DataAccessException ex) {
            log.warn("Could not load plan for {}: {}", correlationId, ex.getMessage());
            return Optional.empty();
        }
    }
}
