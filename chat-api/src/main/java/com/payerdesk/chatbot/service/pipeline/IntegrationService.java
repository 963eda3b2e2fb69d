package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.service.agents.AgentAnswer;
import com.payerdesk.chatbot.service.orchestration.LlmClient;
import com.payerdesk.chatbot.service.orchestration.LlmPrompt;
import com.payerdesk.chatbot.service.orchestration.LlmUsage;
import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.planner.QuestionKind;
import com.payerdesk.chatbot.service.planner.SubQuestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Merges per-sub-question answers into one message. Several answers are combined by a streamed LLM call;
 * the chunks are forwarded as they arrive.
 */
@Service
public class IntegrationService {

    private static final Logger log = LoggerFactory.getLogger(IntegrationService.class);

    static final String FALLBACK_HEADER = "Here's what I found based on your question.";

    private static final String SYSTEM_PROMPT = """
            You combine answers to the parts of one health plan question into a single reply.
            Keep every fact and every [n] citation from the partial answers. Do not add new facts.
            Answer the parts in the order given. Do not use patient-specific details.""";

    private final LlmClient llmClient;
    private final String provider;
    private final String model;
    private final Duration timeout;

    public IntegrationService(LlmClient llmClient,
                              @Value("${chat.llm.provider:openai}") String provider,
                              @Value("${chat.llm.model:gpt-4o-mini}") String model,
                              @Value("${chat.integration.timeout:PT60S}") Duration timeout) {
        this.llmClient = llmClient;
        this.provider = provider;
        this.model = model;
        this.timeout = timeout;
    }

    public IntegratedMessage integrate(Plan plan,
                                       List<AgentAnswer> answers,
                                       String contextPack,
                                       Consumer<String> messageSink) {
        return integrate(plan, answers, contextPack, messageSink, () -> { });
    }

    /**
     * @param messageReset run before the sectioned layout is pushed when the stream broke after some chunks
     */
    public IntegratedMessage integrate(Plan plan,
                                       List<AgentAnswer> answers,
                                       String contextPack,
                                       Consumer<String> messageSink,
                                       Runnable messageReset) {
        if (answers.isEmpty()) {
            String text = FALLBACK_HEADER;
            messageSink.accept(text);
            return new IntegratedMessage(text, null);
        }
        if (answers.size() == 1) {
            String text = answers.get(0).text();
            messageSink.accept(text);
            return new IntegratedMessage(text, null);
        }

        String userPrompt = userPrompt(plan, answers, contextPack);
        AtomicBoolean streamed = new AtomicBoolean();
        try {
            List<String> chunks = llmClient.stream(LlmPrompt.of(SYSTEM_PROMPT, userPrompt))
                    .doOnNext(chunk -> {
                        streamed.set(true);
                        messageSink.accept(chunk);
                    })
                    .collectList()
                    .block(timeout);
            String text = chunks == null ? "" : String.join("", chunks).trim();
            if (!text.isEmpty()) {
                int input = LlmUsage.estimateTokens(SYSTEM_PROMPT) + LlmUsage.estimateTokens(userPrompt);
                return new IntegratedMessage(text, new LlmUsage(provider, model, input, LlmUsage.estimateTokens(text)));
            }
            log.warn("Integrator returned no text, using the sectioned layout");
        } catch (RuntimeException ex) {
            log.warn("Integrator call failed, using the sectioned layout: {}", ex.getMessage());
        }
        if (streamed.get()) {
            messageReset.run();
        }
        String text = deterministicLayout(plan, answers);
        messageSink.accept(text);
        return new IntegratedMessage(text, null);
    }

    static String deterministicLayout(Plan plan, List<AgentAnswer> answers) {
        Map<String, SubQuestion> byId = plan == null ? Map.of() : plan.subquestions().stream()
                .collect(Collectors.toMap(SubQuestion::id, Function.identity(), (first, second) -> first));
        StringBuilder text = new StringBuilder(FALLBACK_HEADER).append('\n');
        for (AgentAnswer answer : answers) {
            SubQuestion subQuestion = byId.get(answer.subQuestionId());
            String kind = subQuestion != null && subQuestion.kind() == QuestionKind.PATIENT
                    ? "Personal (we don't have access yet)"
                    : "Policy/document";
            String question = subQuestion == null ? "" : subQuestion.text();
            text.append("\n**").append(answer.subQuestionId()).append("** (").append(kind).append("): ")
                    .append(question).append("\n→ ").append(answer.text()).append('\n');
        }
        return text.toString().trim();
    }

    private static String userPrompt(Plan plan, List<AgentAnswer> answers, String contextPack) {
        Map<String, SubQuestion> byId = plan.subquestions().stream()
                .collect(Collectors.toMap(SubQuestion::id, Function.identity(), (first, second) -> first));
        StringBuilder prompt = new StringBuilder();
        if (contextPack != null && !contextPack.isBlank()) {
            prompt.append(contextPack.trim()).append("\n\n");
        }
        for (AgentAnswer answer : answers) {
            SubQuestion subQuestion = byId.get(answer.subQuestionId());
            prompt.append("Part ").append(answer.subQuestionId()).append(": ")
                    .append(subQuestion == null ? "" : subQuestion.text()).append('\n')
                    .append("Answer: ").append(answer.text()).append("\n\n");
        }
        prompt.append("Write the combined reply.");
        return prompt.toString();
    }
}
