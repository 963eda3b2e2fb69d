package com.payerdesk.chatbot.service.state;

import com.payerdesk.chatbot.service.memory.TurnRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Chooses how much prior context to carry into the LLM prompts and renders it as a context pack.
 */
@Component
public class ContextRouter {

    private static final Pattern PRONOUN_REFERENCE = Pattern.compile(
            "\\b(that|this|above|same|previous|those|it|them)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEW_TOPIC = Pattern.compile(
            "\\b(new question|different topic|different question|new topic|switch to)\\b", Pattern.CASE_INSENSITIVE);

    private static final String MISSING = "-";
    private static final int LIGHT_ASSISTANT_LIMIT = 200;
    private static final int STATEFUL_ASSISTANT_LIMIT = 300;
    private static final int STATEFUL_TURNS = 2;

    public ContextRoute route(String message, ThreadState state, String resetReason) {
        String text = message == null ? "" : message.trim();
        if (StateExtractor.PAYER_CHANGE.equals(resetReason) || NEW_TOPIC.matcher(text).find()) {
            return ContextRoute.STANDALONE;
        }
        if (PRONOUN_REFERENCE.matcher(text).find() || !state.openSlots().isEmpty()) {
            return ContextRoute.STATEFUL;
        }
        ActiveContext active = state.active();
        if (hasText(active.payer()) || hasText(active.domain())) {
            return ContextRoute.STATEFUL;
        }
        return ContextRoute.LIGHT;
    }

    /**
     * Renders the pack for the given route; {@code lastTurns} is newest first.
     */
    public String buildPack(ContextRoute route, ThreadState state, List<TurnRecord> lastTurns) {
        if (route == ContextRoute.STANDALONE) {
            return "";
        }
        String header = header(state);
        List<TurnRecord> turns = lastTurns == null ? List.of() : lastTurns;
        if (route == ContextRoute.LIGHT) {
            if (turns.isEmpty()) {
                return header + "\n\n";
            }
            TurnRecord last = turns.get(0);
            return header + "\n\nLast turn:\nUser: " + trimmed(last.userContent())
                    + "\nAssistant: " + truncate(trimmed(last.assistantContent()), LIGHT_ASSISTANT_LIMIT) + "\n\n";
        }
        List<String> parts = new ArrayList<>();
        parts.add(header);
        for (int i = 0; i < Math.min(STATEFUL_TURNS, turns.size()); i++) {
            TurnRecord turn = turns.get(i);
            parts.add("Turn " + (i + 1) + ":\nUser: " + trimmed(turn.userContent())
                    + "\nAssistant: " + truncate(trimmed(turn.assistantContent()), STATEFUL_ASSISTANT_LIMIT));
        }
        return String.join("\n\n", parts) + "\n\n";
    }

    String header(ThreadState state) {
        ActiveContext active = state.active();
        String payer = !active.payers().isEmpty() ? String.join(", ", active.payers()) : orMissing(active.payer());
        String slots = state.openSlots().isEmpty() ? "none" : String.join(", ", state.openSlots());
        return "Context: payer=" + payer
                + "; domain=" + orMissing(active.domain())
                + "; jurisdiction=" + orMissing(active.jurisdiction())
                + "; role=" + orMissing(active.userRole())
                + ". Open questions: " + slots + ". Do not use patient-specific details.";
    }

    private static String orMissing(String value) {
        return hasText(value) ? value.trim() : MISSING;
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }

    private static String truncate(String value, int limit) {
        return value.length() > limit ? value.substring(0, limit) + "..." : value;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
