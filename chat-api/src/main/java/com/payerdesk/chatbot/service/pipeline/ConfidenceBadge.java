package com.payerdesk.chatbot.service.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;
import com.payerdesk.chatbot.model.SourceReference;
import com.payerdesk.chatbot.service.retrieval.ConfidenceLabel;
import com.payerdesk.chatbot.service.retrieval.RetrievalChunk;
import com.payerdesk.chatbot.service.retrieval.RetrievalSignal;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Overall confidence strip shown with a completed answer.
 */
public enum ConfidenceBadge {
    NO_SOURCES("no_sources"),
    INFORMATIONAL_ONLY("informational_only"),
    AUGMENTED_WITH_GOOGLE("augmented_with_google"),
    PROCEED_WITH_CAUTION("proceed_with_caution"),
    APPROVED_AUTHORITATIVE("approved_authoritative"),
    APPROVED_INFORMATIONAL("approved_informational");

    private final String wireName;

    ConfidenceBadge(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<ConfidenceBadge> fromWireName(String wireName) {
        for (ConfidenceBadge badge : values()) {
            if (badge.wireName.equals(wireName)) {
                return Optional.of(badge);
            }
        }
        return Optional.empty();
    }

    /**
     * Signals take precedence over corpus labels; external sources do not count towards the labels.
     * No signals at all means nothing was searched.
     */
    public static ConfidenceBadge of(Collection<RetrievalSignal> signals, List<SourceReference> sources) {
        if (signals.isEmpty() || signals.contains(RetrievalSignal.NO_SOURCES)) {
            return NO_SOURCES;
        }
        if (signals.contains(RetrievalSignal.GOOGLE_ONLY)) {
            return INFORMATIONAL_ONLY;
        }
        if (signals.contains(RetrievalSignal.CORPUS_PLUS_GOOGLE)) {
            return AUGMENTED_WITH_GOOGLE;
        }
        List<String> labels = sources.stream()
                .filter(source -> !RetrievalChunk.SOURCE_TYPE_EXTERNAL.equals(source.sourceType()))
                .map(SourceReference::confidenceLabel)
                .toList();
        if (labels.contains(ConfidenceLabel.PROCESS_WITH_CAUTION.wireName())) {
            return PROCEED_WITH_CAUTION;
        }
        if (!labels.isEmpty() && labels.stream().allMatch(ConfidenceLabel.PROCESS_CONFIDENT.wireName()::equals)) {
            return APPROVED_AUTHORITATIVE;
        }
        return APPROVED_INFORMATIONAL;
    }
}
