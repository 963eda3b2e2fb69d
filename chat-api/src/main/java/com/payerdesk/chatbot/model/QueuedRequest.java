package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueuedRequest(String correlationId,
                            String message,
                            String threadId,
                            String sessionId,
                            String userId,
                            long enqueuedAtMillis) {
}
