package com.payerdesk.chatbot.model;

import java.util.List;

public record ProgressSnapshot(List<String> thinkingLines, String partialMessage) {

    public ProgressSnapshot {
        thinkingLines = thinkingLines == null ? List.of() : List.copyOf(thinkingLines);
        partialMessage = partialMessage == null ? "" : partialMessage;
    }
}
