package com.payerdesk.chatbot.service.queue;

import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryChatQueueTest {

    private final InMemoryChatQueue queue = new InMemoryChatQueue();

    @Test
    void requestsArePoppedInOrder() throws InterruptedException {
        queue.publishRequest(request("c1"));
        queue.publishRequest(request("c2"));

        assertThat(queue.pollRequest(Duration.ofMillis(10))).map(QueuedRequest::correlationId).contains("c1");
        assertThat(queue.pollRequest(Duration.ofMillis(10))).map(QueuedRequest::correlationId).contains("c2");
        assertThat(queue.pollRequest(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void firstResponseWins() {
        assertThat(queue.publishResponse(ResponsePayload.failed("c1", "t1", "first"))).isTrue();
        assertThat(queue.publishResponse(ResponsePayload.failed("c1", "t1", "second"))).isFalse();

        assertThat(queue.getResponse("c1")).map(ResponsePayload::message).contains("first");
        assertThat(queue.getResponse("c2")).isEmpty();
    }

    @Test
    void responsesExpireAfterTheirTtl() {
        AtomicLong nanos = new AtomicLong();
        InMemoryChatQueue expiring = new InMemoryChatQueue(Duration.ofHours(24), nanos::get);
        expiring.publishResponse(ResponsePayload.failed("c1", "t1", "done"));

        nanos.addAndGet(Duration.ofHours(23).toNanos());
        assertThat(expiring.getResponse("c1")).isPresent();

        nanos.addAndGet(Duration.ofHours(2).toNanos());
        assertThat(expiring.getResponse("c1")).isEmpty();
        assertThat(expiring.publishResponse(ResponsePayload.failed("c1", "t1", "again"))).isTrue();
    }

    private static QueuedRequest request(String correlationId) {
        return new QueuedRequest(correlationId, "How do I appeal?", "t1", null, "anonymous", 0L);
    }
}
