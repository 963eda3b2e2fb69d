package com.payerdesk.chatbot.service.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a sub-question's answer was grounded on.
 */
public enum RetrievalSignal {
    CORPUS_ONLY("corpus_only"),
    CORPUS_PLUS_GOOGLE("corpus_plus_google"),
    GOOGLE_ONLY("google_only"),
    NO_SOURCES("no_sources");

    private final String wireName;

    RetrievalSignal(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
