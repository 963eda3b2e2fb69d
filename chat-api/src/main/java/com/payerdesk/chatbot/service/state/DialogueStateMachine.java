package com.payerdesk.chatbot.service.state;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides slot fill versus new question, keeps the refined query, and owns the single state mutation path.
 */
@Component
public class DialogueStateMachine {

    private static final int SLOT_ANSWER_MAX_WORDS = 5;
    private static final int AFFIRMATION_MAX_WORDS = 4;
    private static final int NEW_QUESTION_MIN_WORDS = 4;
    private static final int FOLLOW_UP_MAX_WORDS = 4;

    private static final List<Pattern> SLOT_ANSWER_PATTERNS = List.of(
            Pattern.compile("\\b(florida|texas|california|new york|medicaid|medicare)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(as a provider|as a member|as a patient|provider|patient)\\b", Pattern.CASE_INSENSITIVE));

    private static final Pattern AFFIRMATION = Pattern.compile("\\b(same|that one|that|yes)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> NEW_QUESTION_PATTERNS = List.of(
            Pattern.compile("\\b(how do i|how do you|what is|what are|when does|where do)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(also|and then|what about|different question|new topic)\\b", Pattern.CASE_INSENSITIVE));

    private final PayerDirectory payerDirectory;

    public DialogueStateMachine(PayerDirectory payerDirectory) {
        this.payerDirectory = payerDirectory;
    }

    public MessageClassification classify(String message, List<String> openSlots, String lastRefinedQuery) {
        String text = message == null ? "" : message.trim();
        if (text.isEmpty()) {
            return MessageClassification.NEW_QUESTION;
        }
        int words = wordCount(text);

        if (openSlots != null && !openSlots.isEmpty()) {
            if (words <= SLOT_ANSWER_MAX_WORDS && looksLikeSlotAnswer(text)) {
                return MessageClassification.SLOT_FILL;
            }
            if (words <= AFFIRMATION_MAX_WORDS && AFFIRMATION.matcher(text).find()) {
                return MessageClassification.SLOT_FILL;
            }
        }

        if (words >= NEW_QUESTION_MIN_WORDS && NEW_QUESTION_PATTERNS.stream().anyMatch(p -> p.matcher(text).find())) {
            return MessageClassification.NEW_QUESTION;
        }

        if (lastRefinedQuery != null && !lastRefinedQuery.isBlank() && words <= FOLLOW_UP_MAX_WORDS && !text.endsWith("?")) {
            return MessageClassification.SLOT_FILL;
        }
        return MessageClassification.NEW_QUESTION;
    }

    public String buildRefinedQuery(String base, Jurisdiction jurisdiction) {
        String trimmed = base == null ? "" : base.trim();
        if (trimmed.isEmpty() || jurisdiction == null) {
            return trimmed;
        }
        String summary = jurisdiction.summary();
        if (summary.isEmpty() || trimmed.toLowerCase(Locale.ROOT).contains(summary.toLowerCase(Locale.ROOT))) {
            return trimmed;
        }
        return trimmed + " for " + summary;
    }

    /**
     * Slot fills extend the previous refined query; new questions start from the planned text, or the raw message.
     */
    public String computeRefinedQuery(MessageClassification classification,
                                      String userMessage,
                                      String lastRefinedQuery,
                                      String plannedText,
                                      Jurisdiction jurisdiction) {
        if (classification == MessageClassification.SLOT_FILL && lastRefinedQuery != null && !lastRefinedQuery.isBlank()) {
            return buildRefinedQuery(lastRefinedQuery, jurisdiction);
        }
        String base = plannedText != null && !plannedText.isBlank() ? plannedText : userMessage;
        return buildRefinedQuery(base, jurisdiction);
    }

    public ThreadState applyDelta(ThreadState state, StateDelta delta) {
        ThreadState current = state == null ? ThreadState.empty() : state;
        ActiveContext active = current.active();
        for (Map.Entry<ActiveField, Object> entry : delta.active().entrySet()) {
            active = active.with(entry.getKey(), entry.getValue());
        }
        List<String> openSlots = delta.openSlots().orElse(current.openSlots());
        List<String> recentEntities = delta.recentEntities().orElse(current.recentEntities());
        MessageClassification lastIntent = delta.lastUserIntent().orElse(current.lastUserIntent());
        String refinedQuery = delta.hasRefinedQuery() ? delta.refinedQuery() : current.refinedQuery();
        ThreadState.Safety safety = delta.patientAllowed()
                .map(ThreadState.Safety::new)
                .orElse(current.safety());
        return new ThreadState(active, openSlots, recentEntities, lastIntent, refinedQuery, safety);
    }

    private boolean looksLikeSlotAnswer(String text) {
        if (payerDirectory.mentionsPayer(text)) {
            return true;
        }
        return SLOT_ANSWER_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    static int wordCount(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
