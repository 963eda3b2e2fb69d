package com.payerdesk.chatbot.service.state;

import com.payerdesk.chatbot.model.ClarificationOption;
import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.planner.SubQuestion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether the turn needs jurisdiction before anything is retrieved.
 * Only the payer slot is requested, even when state and program are unknown too.
 */
@Component
public class ClarificationPolicy {

    public static final String SLOT_PAYOR = "jurisdiction.payor";
    public static final String SLOT_STATE = "jurisdiction.state";
    public static final String SLOT_PROGRAM = "jurisdiction.program";
    public static final String SLOT_PERSPECTIVE = "jurisdiction.perspective";

    static final String PAYOR_MESSAGE =
            "Which health plan or payer are you asking about? (e.g., Sunshine Health, United Healthcare)";

    private static final Map<String, String> SLOT_LABELS = Map.of(
            SLOT_PAYOR, "Which health plan?",
            SLOT_STATE, "Which state?",
            SLOT_PROGRAM, "Medicare or Medicaid?",
            SLOT_PERSPECTIVE, "As a provider or patient?");

    private static final int MAX_PAYER_EXAMPLES = 4;

    private final PayerProperties payerProperties;

    public ClarificationPolicy(PayerProperties payerProperties) {
        this.payerProperties = payerProperties;
    }

    public Optional<ClarificationRequest> evaluate(Plan plan, Jurisdiction jurisdiction) {
        if (plan == null || plan.isEmpty()) {
            return Optional.empty();
        }
        boolean needsScope = plan.subquestions().stream().anyMatch(SubQuestion::requiresJurisdiction);
        if (!needsScope || (jurisdiction != null && jurisdiction.hasScope())) {
            return Optional.empty();
        }
        List<String> missing = List.of(SLOT_PAYOR);
        return Optional.of(new ClarificationRequest(missing, messageFor(missing), optionsFor(missing)));
    }

    public List<ClarificationOption> optionsFor(List<String> slots) {
        List<ClarificationOption> options = new ArrayList<>();
        for (String slot : slots) {
            String label = SLOT_LABELS.getOrDefault(slot, slot.replace("jurisdiction.", ""));
            options.add(new ClarificationOption(slot, label, examplesFor(slot)));
        }
        return options;
    }

    String messageFor(List<String> missing) {
        if (missing.size() == 1 && missing.contains(SLOT_PAYOR)) {
            return PAYOR_MESSAGE;
        }
        List<String> parts = new ArrayList<>();
        if (missing.contains(SLOT_PAYOR)) {
            parts.add("which health plan or payer");
        }
        if (missing.contains(SLOT_STATE)) {
            parts.add("which state");
        }
        if (missing.contains(SLOT_PROGRAM)) {
            parts.add("Medicare or Medicaid");
        }
        if (parts.isEmpty()) {
            return "To scope this correctly, could you specify the payer, state, or program you're asking about?";
        }
        return "To give you an accurate answer, could you please specify " + String.join(", ", parts) + "?";
    }

    private List<String> examplesFor(String slot) {
        return switch (slot) {
            case SLOT_PAYOR -> payerProperties.getNames().stream()
                    .filter(name -> !payerProperties.getAliases().containsKey(name))
                    .distinct()
                    .limit(MAX_PAYER_EXAMPLES)
                    .toList();
            case SLOT_STATE -> List.of("Florida", "Texas", "New York");
            case SLOT_PROGRAM -> List.of("Medicaid", "Medicare", "Medicare Advantage");
            case SLOT_PERSPECTIVE -> List.of("provider_office", "patient");
            default -> List.of();
        };
    }
}
