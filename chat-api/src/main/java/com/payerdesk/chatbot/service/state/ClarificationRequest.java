package com.payerdesk.chatbot.service.state;

import com.payerdesk.chatbot.model.ClarificationOption;

import java.util.List;

public record ClarificationRequest(List<String> missingSlots, String message, List<ClarificationOption> options) {

    public ClarificationRequest {
        missingSlots = List.copyOf(missingSlots);
        options = options == null ? List.of() : List.copyOf(options);
    }
}
