package com.payerdesk.chatbot.service.queue;

import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;

import java.time.Duration;
import java.util.Optional;

/**
 * Request queue and response store shared by the acceptor and the worker.
 */
public interface ChatQueue {

    void publishRequest(QueuedRequest request);

    /**
     * Waits at most {@code timeout} for the next request.
     */
    Optional<QueuedRequest> pollRequest(Duration timeout) throws InterruptedException;

    /**
     * Stores the terminal payload. Returns false when a payload was already stored for the correlation id.
     */
    boolean publishResponse(ResponsePayload payload);

    Optional<ResponsePayload> getResponse(String correlationId);
}
