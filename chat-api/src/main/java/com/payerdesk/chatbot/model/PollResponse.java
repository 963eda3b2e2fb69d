package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PollResponse(ResponseStatus status, List<String> thinkingLog, String message) implements PollResult {

    public static PollResponse pending() {
        return new PollResponse(ResponseStatus.PENDING, null, null);
    }

    public static PollResponse processing(ProgressSnapshot snapshot) {
        return new PollResponse(ResponseStatus.PROCESSING, snapshot.thinkingLines(), snapshot.partialMessage());
    }
}
