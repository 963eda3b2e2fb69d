package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.service.orchestration.LlmClient;
import com.payerdesk.chatbot.service.orchestration.LlmException;
import com.payerdesk.chatbot.service.orchestration.LlmPrompt;
import com.payerdesk.chatbot.service.orchestration.LlmResult;
import com.payerdesk.chatbot.service.orchestration.LlmUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

@Component
@EnableConfigurationProperties(PlannerProperties.class)
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private static final List<String> CANONICAL_PREFIXES = List.of(
            "what is the process", "describe", "explain", "how does", "how do", "summarize", "outline");
    private static final List<String> FACTUAL_PREFIXES = List.of(
            "what is", "what are", "how many", "when", "where", "which", "who");

    private static final int PART_SNIPPET_LIMIT = 50;

    private static final String DECOMPOSITION_SYSTEM_PROMPT = """
            You split a health-plan policy question into ordered sub-questions.
            Return a JSON object {"subquestions": [...]} where each item has:
            "text" (the sub-question, self-contained),
            "kind" ("patient" when it is about the user's own records, "tool" when it asks for web search or scraping, else "non_patient"),
            "question_intent" ("canonical" for process or policy questions, "factual" for a specific fact),
            "intent_score" (0.0 for canonical up to 1.0 for factual),
            "capabilities_primary" ("reasoning" for conceptual questions that need no documents, "web" for web lookups, or null).
            Do not invent sub-questions the user did not ask.""";

    private final PlannerProperties properties;
    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public QueryPlanner(PlannerProperties properties, LlmClient llmClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    public Plan plan(String message, String contextPack, Consumer<String> thinking) {
        String text = message == null ? "" : message.trim();
        List<String> thinkingLog = new ArrayList<>();
        Consumer<String> emit = line -> {
            thinkingLog.add(line);
            thinking.accept(line);
        };
        emit.accept("I'm reading your question and breaking it down.");

        if (properties.isLlmDecompositionEnabled()) {
            Optional<Plan> decomposed = decomposeWithLlm(text, contextPack, thinkingLog, emit);
            if (decomposed.isPresent()) {
                return decomposed.get();
            }
            log.debug("LLM decomposition unavailable, using rule-based split");
        }

        List<String> fragments = split(text);
        List<SubQuestion> subQuestions = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            subQuestions.add(classify("sq" + (i + 1), fragments.get(i), null, null, null, null));
        }
        emit.accept(subQuestions.size() == 1
                ? "This looks like a single question."
                : "I found " + subQuestions.size() + " parts to answer.");
        describeParts(subQuestions, emit);
        return new Plan(subQuestions, thinkingLog, null);
    }

    /**
     * One line per part saying whether it can be looked up, then one line on the personal parts.
     */
    static void describeParts(List<SubQuestion> subQuestions, Consumer<String> emit) {
        int personal = 0;
        for (SubQuestion subQuestion : subQuestions) {
            String text = subQuestion.text();
            String snippet = text.length() > PART_SNIPPET_LIMIT ? text.substring(0, PART_SNIPPET_LIMIT) + "..." : text;
            if (subQuestion.kind() == QuestionKind.PATIENT) {
                personal++;
                emit.accept("• " + subQuestion.id() + ": \"" + snippet
                        + "\" - This looks personal; I don't have access to your records.");
            } else {
                emit.accept("• " + subQuestion.id() + ": \"" + snippet + "\" - I can look this up.");
            }
        }
        int other = subQuestions.size() - personal;
        if (personal == 0) {
            emit.accept("Nothing personal in there. I can answer from what we have on file.");
        } else if (other == 0) {
            emit.accept("These are about your own info. I can't access that yet, so I'll say so where it comes up.");
        } else {
            emit.accept((personal == 1 ? "One part is" : personal + " parts are") + " about your own info; I'll answer the other "
                    + other + " from our materials.");
        }
    }

    /**
     * Single sub-question plan over the raw message, used whenever planning fails outright.
     */
    public Plan minimalPlan(String message) {
        String text = message == null ? "" : message.trim();
        QuestionIntent intent = heuristicIntent(text);
        SubQuestion subQuestion = new SubQuestion("sq1", text, QuestionKind.NON_PATIENT, intent,
                QuestionIntent.scoreOf(intent), List.of(SubQuestion.ON_RAG_FAIL_EXTERNAL_SEARCH), null, true);
        return new Plan(List.of(subQuestion), List.of(), null);
    }

    List<String> split(String text) {
        List<String> fragments = List.of(text);
        for (String separator : properties.getSeparators()) {
            if (separator == null || separator.isEmpty()) {
                continue;
            }
            Pattern pattern = Pattern.compile(Pattern.quote(separator), Pattern.CASE_INSENSITIVE);
            List<String> next = new ArrayList<>();
            for (String fragment : fragments) {
                for (String part : pattern.split(fragment)) {
                    if (!part.isBlank()) {
                        next.add(part.trim());
                    }
                }
            }
            fragments = next;
        }
        return fragments.isEmpty() ? List.of(text) : List.copyOf(fragments);
    }

    QuestionKind classifyKind(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (properties.getPatientKeywords().stream().anyMatch(lower::contains)) {
            return QuestionKind.PATIENT;
        }
        if (properties.getToolPhrases().stream().anyMatch(lower::contains)) {
            return QuestionKind.TOOL;
        }
        return QuestionKind.NON_PATIENT;
    }

    static QuestionIntent heuristicIntent(String text) {
        String lower = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        for (String prefix : CANONICAL_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return QuestionIntent.CANONICAL;
            }
        }
        for (String prefix : FACTUAL_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return QuestionIntent.FACTUAL;
            }
        }
        return null;
    }

    private SubQuestion classify(String id,
                                 String text,
                                 QuestionKind llmKind,
                                 QuestionIntent llmIntent,
                                 Double llmScore,
                                 String llmCapability) {
        QuestionKind kind = llmKind != null ? llmKind : classifyKind(text);
        QuestionIntent intent = llmIntent != null ? llmIntent : heuristicIntent(text);
        double score = llmScore != null ? llmScore : QuestionIntent.scoreOf(intent);
        String capability = llmCapability != null ? llmCapability : capabilityFor(text, kind);
        boolean requiresJurisdiction = kind == QuestionKind.NON_PATIENT
                && !SubQuestion.CAPABILITY_REASONING.equals(capability);
        List<String> onRagFail = kind == QuestionKind.NON_PATIENT
                ? List.of(SubQuestion.ON_RAG_FAIL_EXTERNAL_SEARCH)
                : List.of();
        return new SubQuestion(id, text, kind, intent, score, onRagFail, capability, requiresJurisdiction);
    }

    private String capabilityFor(String text, QuestionKind kind) {
        if (kind == QuestionKind.TOOL) {
            return SubQuestion.CAPABILITY_WEB;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (kind == QuestionKind.NON_PATIENT && properties.getReasoningPrefixes().stream().anyMatch(lower::startsWith)) {
            return SubQuestion.CAPABILITY_REASONING;
        }
        return null;
    }

    private Optional<Plan> decomposeWithLlm(String text,
                                            String contextPack,
                                            List<String> thinkingLog,
                                            Consumer<String> emit) {
        String userPrompt = (contextPack == null || contextPack.isBlank() ? "" : contextPack + "\n\n")
                + "User message:\n" + text;
        try {
            LlmResult result = llmClient.generate(LlmPrompt.json(DECOMPOSITION_SYSTEM_PROMPT, userPrompt));
            JsonNode items = objectMapper.readTree(sanitize(result.text())).path("subquestions");
            if (!items.isArray() || items.isEmpty()) {
                return Optional.empty();
            }
            List<SubQuestion> subQuestions = new ArrayList<>();
            for (JsonNode item : items) {
                String subText = item.path("text").asText("").trim();
                if (subText.isEmpty()) {
                    continue;
                }
                QuestionKind kind = QuestionKind.fromWireName(item.path("kind").asText(null)).orElse(null);
                QuestionIntent intent = QuestionIntent.fromWireName(item.path("question_intent").asText(null)).orElse(null);
                Double score = item.hasNonNull("intent_score") ? item.get("intent_score").asDouble() : null;
                String capability = item.hasNonNull("capabilities_primary") ? item.get("capabilities_primary").asText() : null;
                subQuestions.add(classify("sq" + (subQuestions.size() + 1), subText, kind, intent, score, capability));
            }
            if (subQuestions.isEmpty()) {
                return Optional.empty();
            }
            emit.accept("I found " + subQuestions.size() + " part" + (subQuestions.size() == 1 ? "" : "s") + " to answer.");
            describeParts(subQuestions, emit);
            LlmUsage usage = result.usage();
            return Optional.of(new Plan(subQuestions, thinkingLog, usage));
        } catch (LlmException ex) {
            log.warn("LLM decomposition failed: {}", ex.getMessage());
            return Optional.empty();
        } catch (Exception ex) {
            log.warn("LLM decomposition returned unparseable output: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private String sanitize(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```")) {
            trimmed = trimmed.replaceAll("^```(json)?\\s*", "");
            trimmed = trimmed.substring(0, trimmed.length() - 3).trim();
        }
        return trimmed;
    }
}
