package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentType {
    RAG("RAG"),
    PATIENT_STUB("patient_stub"),
    TOOL("tool"),
    REASONING("reasoning");

    private final String wireName;

    AgentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
