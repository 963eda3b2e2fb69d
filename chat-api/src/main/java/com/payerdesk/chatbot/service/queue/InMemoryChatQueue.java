package com.payerdesk.chatbot.service.queue;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Co-located backend: acceptor and worker share this process. Responses expire like their Redis
 * counterparts, and the oldest are dropped past {@link #MAX_RESPONSES}.
 */
public class InMemoryChatQueue implements ChatQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChatQueue.class);

    static final int MAX_RESPONSES = 10_000;

    private final BlockingQueue<QueuedRequest> requests = new LinkedBlockingQueue<>();
    private final Cache<String, ResponsePayload> responses;

    public InMemoryChatQueue() {
        this(RedisChatQueue.RESPONSE_TTL, Ticker.systemTicker());
    }

    InMemoryChatQueue(Duration responseTtl, Ticker ticker) {
        this.responses = Caffeine.newBuilder()
                .maximumSize(MAX_RESPONSES)
                .expireAfterWrite(responseTtl)
                .ticker(ticker)
                .build();
    }

    @Override
    public void publishRequest(QueuedRequest request) {
        requests.add(request);
    }

    @Override
    public Optional<QueuedRequest> pollRequest(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(requests.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean publishResponse(ResponsePayload payload) {
        ResponsePayload existing = responses.asMap().putIfAbsent(payload.correlationId(), payload);
        if (existing != null) {
            log.warn("Ignoring second response for {}", payload.correlationId());
            return false;
        }
        return true;
    }

    @Override
    public Optional<ResponsePayload> getResponse(String correlationId) {
        return Optional.ofNullable(responses.getIfPresent(correlationId));
    }
}
