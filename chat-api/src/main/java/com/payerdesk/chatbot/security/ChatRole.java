package com.payerdesk.chatbot.security;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Who is asking. Provider offices and members reach the chat routes directly, trusted front ends as clients.
 */
public enum ChatRole {

    PROVIDER_OFFICE(Set.of("provider_office", "provider", "clinic", "office_staff")),
    MEMBER(Set.of("member", "patient", "subscriber")),
    CHAT_CLIENT(Set.of("chat_client", "client", "service"));

    private final Set<String> claimValues;

    ChatRole(Set<String> claimValues) {
        this.claimValues = claimValues;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public static String[] names() {
        return Arrays.stream(values()).map(Enum::name).toArray(String[]::new);
    }

    /**
     * Resolves a token claim value such as {@code provider} or {@code ROLE_MEMBER}.
     */
    public static Optional<ChatRole> fromClaim(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.startsWith("role_")) {
            normalized = normalized.substring("role_".length());
        }
        String candidate = normalized;
        return Arrays.stream(values())
                .filter(role -> role.claimValues.contains(candidate))
                .findFirst();
    }
}
