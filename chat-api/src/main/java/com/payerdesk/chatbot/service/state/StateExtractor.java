package com.payerdesk.chatbot.service.state;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule-based delta extraction from one user message. No LLM calls, and nothing patient-specific is ever written.
 */
@Component
public class StateExtractor {

    public static final String PAYER_CHANGE = "payer_change";

    private static final Map<String, List<String>> DOMAIN_KEYWORDS = domainKeywords();

    private static final List<String> STATE_CODES = List.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA", "HI", "ID", "IL", "IN", "IA", "KS", "KY",
            "LA", "ME", "MD", "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ", "NM", "NY", "NC", "ND",
            "OH", "OK", "OR", "PA", "RI", "SC", "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY");

    private static final List<String> STATE_NAMES = List.of(
            "North Carolina", "South Carolina", "North Dakota", "South Dakota", "New York", "New Jersey",
            "New Mexico", "New Hampshire", "West Virginia", "Rhode Island", "Alabama", "Alaska", "Arizona",
            "Arkansas", "California", "Colorado", "Connecticut", "Delaware", "Florida", "Georgia", "Hawaii",
            "Idaho", "Illinois", "Indiana", "Iowa", "Kansas", "Kentucky", "Louisiana", "Maine", "Maryland",
            "Massachusetts", "Michigan", "Minnesota", "Mississippi", "Missouri", "Montana", "Nebraska", "Nevada",
            "Ohio", "Oklahoma", "Oregon", "Pennsylvania", "Tennessee", "Texas", "Utah", "Vermont", "Virginia",
            "Washington", "Wisconsin", "Wyoming");

    private static final List<String> PROGRAMS = List.of("Medicare Advantage", "Medicaid", "Medicare", "CHIP", "Marketplace");

    private static final List<String> PROVIDER_PHRASES = List.of(
            "as a provider", "our clinic", "our office", "provider portal", "we are a provider", "provider office");
    private static final List<String> PATIENT_PHRASES = List.of(
            "as a member", "as a patient", "i am a patient", "i'm a patient");

    private static final Map<String, Pattern> SLOT_ANSWER_PATTERNS = Map.of(
            "service_code", Pattern.compile("\\b(CPT|HCPCS|procedure\\s+code)\\s*[:\\s]*\\d+|\\b\\d{5}(-\\d{2})?\\b", Pattern.CASE_INSENSITIVE),
            "plan_type", Pattern.compile("\\b(plan\\s+is|medicaid|medicare|commercial|ppo|hmo)\\b", Pattern.CASE_INSENSITIVE),
            "member_type", Pattern.compile("\\b(member\\s+type|subscriber|dependent)\\b", Pattern.CASE_INSENSITIVE),
            "provider_type", Pattern.compile("\\b(provider\\s+type|npi|facility)\\b", Pattern.CASE_INSENSITIVE));

    private final PayerDirectory payerDirectory;

    public StateExtractor(PayerDirectory payerDirectory) {
        this.payerDirectory = payerDirectory;
    }

    public StateDelta extract(String message, ThreadState existing, MessageClassification classification) {
        String text = message == null ? "" : message.trim();
        ActiveContext active = existing.active();
        StateDelta.Builder delta = StateDelta.builder().lastUserIntent(classification);
        List<String> entities = new ArrayList<>();

        boolean payerChanged = false;
        List<String> payers = payerDirectory.detectAll(text);
        if (payers.size() == 1) {
            String payer = payers.get(0);
            delta.active(ActiveField.PAYER, payer).active(ActiveField.PAYERS, List.of());
            payerChanged = active.payer() != null && !active.payer().trim().equalsIgnoreCase(payer);
        } else if (payers.size() > 1) {
            delta.clear(ActiveField.PAYER).active(ActiveField.PAYERS, payers);
            payerChanged = true;
        }
        entities.addAll(payers);

        boolean slotsReset = false;
        if (payerChanged) {
            delta.clear(ActiveField.DOMAIN).openSlots(List.of()).resetReason(PAYER_CHANGE);
            slotsReset = true;
        } else {
            Optional<String> domain = detectDomain(text);
            if (domain.isPresent()) {
                delta.active(ActiveField.DOMAIN, domain.get());
                if (active.domain() != null && !active.domain().equalsIgnoreCase(domain.get())) {
                    delta.openSlots(List.of());
                    slotsReset = true;
                }
            }
        }

        Optional<String> state = detectState(text);
        state.ifPresent(value -> {
            delta.active(ActiveField.JURISDICTION, value);
            entities.add(value);
        });
        Optional<String> program = detectProgram(text);
        program.ifPresent(value -> {
            delta.active(ActiveField.PROGRAM, value);
            entities.add(value);
        });
        Optional<String> role = detectRole(text);
        role.ifPresent(value -> delta.active(ActiveField.USER_ROLE, value));

        if (!slotsReset && !existing.openSlots().isEmpty()) {
            List<String> remaining = existing.openSlots().stream()
                    .filter(slot -> !isFulfilled(slot, text, !payers.isEmpty(), state.isPresent(), program.isPresent(), role.isPresent()))
                    .toList();
            if (remaining.size() != existing.openSlots().size()) {
                delta.openSlots(remaining);
            }
        }

        if (!entities.isEmpty()) {
            delta.recentEntities(entities.stream().limit(5).toList());
        }
        return delta.build();
    }

    Optional<String> detectDomain(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : DOMAIN_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    Optional<String> detectState(String text) {
        for (String code : STATE_CODES) {
            if (Pattern.compile("\\b" + code + "\\b").matcher(text).find()) {
                return Optional.of(code);
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return STATE_NAMES.stream()
                .filter(name -> Pattern.compile("\\b" + Pattern.quote(name.toLowerCase(Locale.ROOT)) + "\\b").matcher(lower).find())
                .findFirst();
    }

    Optional<String> detectProgram(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return PROGRAMS.stream()
                .filter(program -> Pattern.compile("\\b" + Pattern.quote(program.toLowerCase(Locale.ROOT)) + "\\b").matcher(lower).find())
                .findFirst();
    }

    Optional<String> detectRole(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (PROVIDER_PHRASES.stream().anyMatch(lower::contains)) {
            return Optional.of("provider_office");
        }
        if (PATIENT_PHRASES.stream().anyMatch(lower::contains)) {
            return Optional.of("patient");
        }
        return Optional.empty();
    }

    private boolean isFulfilled(String slot, String text, boolean payer, boolean state, boolean program, boolean role) {
        return switch (slot) {
            case ClarificationPolicy.SLOT_PAYOR -> payer;
            case ClarificationPolicy.SLOT_STATE -> state;
            case ClarificationPolicy.SLOT_PROGRAM -> program;
            case ClarificationPolicy.SLOT_PERSPECTIVE -> role;
            default -> {
                Pattern pattern = SLOT_ANSWER_PATTERNS.get(slot);
                yield pattern != null && pattern.matcher(text).find();
            }
        };
    }

    private static Map<String, List<String>> domainKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("prior_auth", List.of("prior auth", "preauth", "pre-auth", "authorization"));
        keywords.put("disputes", List.of("dispute", "appeal", "reconsideration", "grievance"));
        keywords.put("eligibility", List.of("eligibility", "eligible", "coverage", "enroll"));
        keywords.put("contacts", List.of("contact", "phone", "fax", "provider relations"));
        keywords.put("um", List.of("utilization management", "utilization review"));
        keywords.put("claims", List.of("claim", "denial", "eob", "explanation of benefits"));
        keywords.put("billing", List.of("billing", "payment", "reimbursement", "invoice"));
        keywords.put("benefits", List.of("benefit"));
        return keywords;
    }
}
