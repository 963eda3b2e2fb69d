package com.payerdesk.chatbot.service.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisChatQueueTest {

    private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
    @SuppressWarnings("unchecked")
    private final ListOperations<String, String> listOps = mock(ListOperations.class);
    @SuppressWarnings("unchecked")
    private final ValueOperations<String, String> valueOps = mock(ValueOperations.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RedisChatQueue queue = new RedisChatQueue(redisTemplate, objectMapper);

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
    }

    @Test
    void requestsArePushedAsSnakeCaseJson() {
        queue.publishRequest(new QueuedRequest("c1", "How do I appeal?", "t1", null, "anonymous", 42L));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(listOps).leftPush(eq(RedisChatQueue.REQUESTS_KEY), json.capture());
        assertThat(json.getValue()).contains("\"correlation_id\":\"c1\"").contains("\"enqueued_at_millis\":42");
    }

    @Test
    void pollDecodesTheOldestRequestAndDropsGarbage() throws Exception {
        QueuedRequest request = new QueuedRequest("c1", "How do I appeal?", "t1", "s1", "anonymous", 42L);
        when(listOps.rightPop(RedisChatQueue.REQUESTS_KEY, 2L, TimeUnit.SECONDS))
                .thenReturn(objectMapper.writeValueAsString(request), "not json", null);

        assertThat(queue.pollRequest(Duration.ofSeconds(2))).contains(request);
        assertThat(queue.pollRequest(Duration.ofSeconds(2))).isEmpty();
        assertThat(queue.pollRequest(Duration.ofSeconds(2))).isEmpty();
    }

    @Test
    void responsesAreWrittenOnce() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true, false);
        ResponsePayload payload = ResponsePayload.failed("c1", "t1", "Something went wrong.");

        assertThat(queue.publishResponse(payload)).isTrue();
        assertThat(queue.publishResponse(payload)).isFalse();
        verify(valueOps, times(2))
                .setIfAbsent(eq(RedisChatQueue.RESPONSE_PREFIX + "c1"), anyString(), eq(Duration.ofHours(24)));
    }

    @Test
    void storedResponsesAreReadBack() throws Exception {
        ResponsePayload payload = ResponsePayload.failed("c1", "t1", "Something went wrong.");
        when(valueOps.get(RedisChatQueue.RESPONSE_PREFIX + "c1")).thenReturn(objectMapper.writeValueAsString(payload));

        assertThat(queue.getResponse("c1")).contains(payload);
        assertThat(queue.getResponse("c2")).isEmpty();
    }
}
