package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.service.orchestration.LlmClient;
import com.payerdesk.chatbot.service.orchestration.LlmException;
import com.payerdesk.chatbot.service.orchestration.LlmPrompt;
import com.payerdesk.chatbot.service.orchestration.LlmResult;
import com.payerdesk.chatbot.service.planner.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * LLM-only path for conceptual questions. No retrieval.
 */
@Component
public class ReasoningAgent implements AnsweringAgent {

    private static final Logger log = LoggerFactory.getLogger(ReasoningAgent.class);

    static final String FAILURE_TEXT = "I had trouble generating an answer. Please try again.";
    static final String EMPTY_TEXT = "I'm not sure how to answer that. Could you rephrase or provide more context?";

    private static final String SYSTEM_PROMPT = """
            You are a helpful assistant. The user asked a question that does not require looking up documents.
            Provide a clear, concise explanation using your general knowledge. If you're unsure, say so.
            Keep it conversational and not overly long. Do not use patient-specific details.""";

    private final LlmClient llmClient;

    public ReasoningAgent(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public AgentType type() {
        return AgentType.REASONING;
    }

    @Override
    public AgentAnswer answer(AgentTask task) {
        String id = task.subQuestion().id();
        try {
            LlmResult result = llmClient.generate(LlmPrompt.of(SYSTEM_PROMPT, "User question: " + task.questionText()));
            String text = result.text() == null ? "" : result.text().trim();
            return AgentAnswer.withoutSources(id, text.isEmpty() ? EMPTY_TEXT : text, result.usage());
        } catch (LlmException ex) {
            log.warn("Reasoning agent failed for {}: {}", id, ex.getMessage());
            return AgentAnswer.withoutSources(id, FAILURE_TEXT, null);
        }
    }
}
