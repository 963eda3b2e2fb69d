package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.model.SourceReference;
import com.payerdesk.chatbot.service.orchestration.LlmUsage;
import com.payerdesk.chatbot.service.retrieval.RetrievalSignal;

import java.util.List;

/**
 * Normalized result of any agent path. {@code usage} is null when no LLM call was made.
 */
public record AgentAnswer(String subQuestionId,
                          String text,
                          LlmUsage usage,
                          List<SourceReference> sources,
                          RetrievalSignal signal) {

    public AgentAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
        signal = signal == null ? RetrievalSignal.NO_SOURCES : signal;
    }

    public static AgentAnswer withoutSources(String subQuestionId, String text, LlmUsage usage) {
        return new AgentAnswer(subQuestionId, text, usage, List.of(), RetrievalSignal.NO_SOURCES);
    }
}
