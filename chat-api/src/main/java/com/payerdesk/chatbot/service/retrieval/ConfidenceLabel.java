package com.payerdesk.chatbot.service.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ConfidenceLabel {
    ABSTAIN("abstain", "Do not send"),
    PROCESS_WITH_CAUTION("process_with_caution", "Use but reconcile across docs"),
    PROCESS_CONFIDENT("process_confident", "Likely correct; verify no conflicts");

    private final String wireName;
    private final String guidance;

    ConfidenceLabel(String wireName, String guidance) {
        this.wireName = wireName;
        this.guidance = guidance;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String guidance() {
        return guidance;
    }

    public static Optional<ConfidenceLabel> fromWireName(String value) {
        return Arrays.stream(values()).filter(label -> label.wireName.equals(value)).findFirst();
    }
}
