package com.payerdesk.chatbot.service.state;

import java.util.List;

public record RefinementRequest(List<String> suggestions, String message) {

    public RefinementRequest {
        suggestions = List.copyOf(suggestions);
    }
}
