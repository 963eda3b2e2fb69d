package com.payerdesk.chatbot.service.state;

import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.planner.QuestionIntent;
import com.payerdesk.chatbot.service.planner.QuestionKind;
import com.payerdesk.chatbot.service.planner.SubQuestion;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Asks the user to confirm or rephrase when the plan looks vague, multi-intent or ambiguous.
 * The intent checks apply to corpus questions only; tool, reasoning and patient parts are answerable as asked.
 */
@Component
public class QueryRefinementPolicy {

    private static final int MAX_SUGGESTIONS = 3;

    private final int vagueMinWords;
    private final int multiIntentThreshold;
    private final double ambiguityBand;

    public QueryRefinementPolicy(@Value("${chat.refinement.vague-min-words:3}") int vagueMinWords,
                                 @Value("${chat.refinement.multi-intent-threshold:3}") int multiIntentThreshold,
                                 @Value("${chat.refinement.ambiguity-band:0.1}") double ambiguityBand) {
        this.vagueMinWords = vagueMinWords;
        this.multiIntentThreshold = multiIntentThreshold;
        this.ambiguityBand = ambiguityBand;
    }

    public Optional<RefinementRequest> evaluate(Plan plan) {
        if (plan == null || plan.isEmpty()) {
            return Optional.empty();
        }
        List<SubQuestion> subQuestions = plan.subquestions();

        if (subQuestions.size() == 1) {
            String text = subQuestions.get(0).text().trim();
            if (DialogueStateMachine.wordCount(text) < vagueMinWords) {
                return Optional.of(request(List.of(text)));
            }
        }

        if (subQuestions.size() >= multiIntentThreshold) {
            List<String> suggestions = subQuestions.stream()
                    .map(sq -> sq.text().trim())
                    .filter(text -> !text.isEmpty())
                    .limit(MAX_SUGGESTIONS)
                    .toList();
            return Optional.of(request(suggestions));
        }

        return subQuestions.stream()
                .filter(this::isCorpusQuestion)
                .filter(sq -> Math.abs(sq.intentScore() - QuestionIntent.UNKNOWN_SCORE) < ambiguityBand)
                .findFirst()
                .map(sq -> request(List.of(sq.text().trim())));
    }

    private boolean isCorpusQuestion(SubQuestion subQuestion) {
        return subQuestion.kind() == QuestionKind.NON_PATIENT
                && !SubQuestion.CAPABILITY_REASONING.equals(subQuestion.capabilitiesPrimary());
    }

    static RefinementRequest request(List<String> suggestions) {
        StringBuilder message = new StringBuilder(
                "I want to make sure I understand. Could you confirm or rephrase what you're asking?");
        for (String suggestion : suggestions) {
            message.append("\n- ").append(suggestion);
        }
        return new RefinementRequest(suggestions, message.toString());
    }
}
