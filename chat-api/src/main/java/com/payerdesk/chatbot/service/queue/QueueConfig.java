package com.payerdesk.chatbot.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.config.MissingConfigurationException;
import com.payerdesk.chatbot.service.planner.InMemoryPlanStore;
import com.payerdesk.chatbot.service.planner.PlanStore;
import com.payerdesk.chatbot.service.planner.RedisPlanStore;
import com.payerdesk.chatbot.service.progress.InMemoryProgressStore;
import com.payerdesk.chatbot.service.progress.ProgressStore;
import com.payerdesk.chatbot.service.progress.RedisProgressStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Locale;

/**
 * Selects the queue, response store, progress store and plan store backend from {@code chat.queue.backend}.
 */
@Configuration
public class QueueConfig {

    static final String MEMORY = "memory";
    static final String REDIS = "redis";

    private final String backend;

    public QueueConfig(@Value("${chat.queue.backend:memory}") String backend) {
        this.backend = backend == null ? "" : backend.trim().toLowerCase(Locale.ROOT);
        if (!MEMORY.equals(this.backend) && !REDIS.equals(this.backend)) {
            throw new MissingConfigurationException("Unknown chat.queue.backend '" + backend + "' (expected memory or redis)");
        }
    }

    @Bean
    public ChatQueue chatQueue(ObjectProvider<StringRedisTemplate> redisTemplate, ObjectMapper objectMapper) {
        if (REDIS.equals(backend)) {
            return new RedisChatQueue(requireRedis(redisTemplate), objectMapper);
        }
        return new InMemoryChatQueue();
    }

    @Bean
    public ProgressStore progressStore(ObjectProvider<StringRedisTemplate> redisTemplate,
                                       ObjectMapper objectMapper,
                                       @Value("${chat.progress.max-events:1000}") int maxEvents) {
        if (REDIS.equals(backend)) {
            return new RedisProgressStore(requireRedis(redisTemplate), objectMapper, maxEvents);
        }
        return new InMemoryProgressStore(maxEvents);
    }

    @Bean
    public PlanStore planStore(ObjectProvider<StringRedisTemplate> redisTemplate,
                               ObjectMapper objectMapper,
                               @Value("${chat.planner.store-capacity:500}") int capacity) {
        if (REDIS.equals(backend)) {
            return new RedisPlanStore(requireRedis(redisTemplate), objectMapper, RedisChatQueue.RESPONSE_TTL);
        }
        return new InMemoryPlanStore(capacity);
    }

    private static StringRedisTemplate requireRedis(ObjectProvider<StringRedisTemplate> redisTemplate) {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null) {
            throw new MissingConfigurationException("chat.queue.backend=redis requires a Redis connection");
        }
        return template;
    }
}
