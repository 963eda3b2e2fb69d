package com.payerdesk.chatbot.service.state;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The only keys a state delta may write under {@code active}. Nothing patient-identifying belongs here.
 */
public enum ActiveField {
    PAYER("payer"),
    PAYERS("payers"),
    DOMAIN("domain"),
    JURISDICTION("jurisdiction"),
    PROGRAM("program"),
    USER_ROLE("user_role"),
    JURISDICTION_OBJ("jurisdiction_obj");

    private final String key;

    ActiveField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<ActiveField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(field -> field.key.equals(normalized))
                .findFirst();
    }
}
