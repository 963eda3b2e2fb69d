package com.payerdesk.chatbot.service.state;

import java.util.ArrayList;
import java.util.List;

public record Jurisdiction(String state,
                           String payor,
                           String program,
                           String perspective,
                           String regulatoryAgency) {

    public static Jurisdiction empty() {
        return new Jurisdiction(null, null, null, null, null);
    }

    /**
     * Payor, state, program or regulatory agency is enough scope to answer without asking.
     */
    public boolean hasScope() {
        return hasText(payor) || hasText(state) || hasText(program) || hasText(regulatoryAgency);
    }

    public String summary() {
        List<String> parts = new ArrayList<>();
        if (hasText(payor)) {
            parts.add(payor.trim());
        }
        if (hasText(state)) {
            parts.add("in " + state.trim());
        }
        if (hasText(program)) {
            parts.add("(" + program.trim() + ")");
        }
        return String.join(" ", parts);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
