package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatRequest(@NotBlank @Size(max = 8000) String message,
                          String threadId,
                          String sessionId) {
}
