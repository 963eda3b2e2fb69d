package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum QuestionIntent {
    CANONICAL(0.0),
    FACTUAL(1.0);

    /**
     * Score used when an intent could not be determined.
     */
    public static final double UNKNOWN_SCORE = 0.5;

    private final double score;

    QuestionIntent(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static double scoreOf(QuestionIntent intent) {
        return intent == null ? UNKNOWN_SCORE : intent.score;
    }

    public static Optional<QuestionIntent> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(intent -> intent.wireName().equals(normalized)).findFirst();
    }
}
