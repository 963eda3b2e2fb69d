package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
