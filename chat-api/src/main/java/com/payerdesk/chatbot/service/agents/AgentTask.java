package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.service.planner.BlueprintEntry;
import com.payerdesk.chatbot.service.planner.SubQuestion;
import com.payerdesk.chatbot.service.retrieval.SearchFilters;

import java.util.function.Consumer;

/**
 * One sub-question handed to an agent, with its blueprint directive and the turn's shared inputs.
 */
public record AgentTask(SubQuestion subQuestion,
                        BlueprintEntry entry,
                        SearchFilters filters,
                        String contextPack,
                        Consumer<String> thinking) {

    public String questionText() {
        String reframed = entry == null ? null : entry.reframedText();
        return reframed != null && !reframed.isBlank() ? reframed : subQuestion.text();
    }
}
