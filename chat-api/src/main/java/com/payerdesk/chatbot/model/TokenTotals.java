package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenTotals(int inputTokens, int outputTokens) {

    public static TokenTotals empty() {
        return new TokenTotals(0, 0);
    }
}
