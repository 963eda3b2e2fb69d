package com.payerdesk.chatbot.service.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageClassification {
    SLOT_FILL,
    NEW_QUESTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
