package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ResponseStatus {
    PENDING(false),
    PROCESSING(false),
    CLARIFICATION(true),
    REFINEMENT_ASK(true),
    COMPLETED(true),
    FAILED(true);

    private final boolean terminal;

    ResponseStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseStatus fromWireName(String value) {
        return ResponseStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
