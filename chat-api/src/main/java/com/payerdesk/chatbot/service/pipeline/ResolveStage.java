package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.service.agents.AgentAnswer;
import com.payerdesk.chatbot.service.agents.AgentRouter;
import com.payerdesk.chatbot.service.agents.AgentTask;
import com.payerdesk.chatbot.service.planner.BlueprintEntry;
import com.payerdesk.chatbot.service.planner.SubQuestion;
import com.payerdesk.chatbot.service.retrieval.SearchFilters;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Answers each sub-question in declared order through the agent its blueprint entry names.
 */
@Component
public class ResolveStage implements StageHandler {

    private final AgentRouter agentRouter;

    public ResolveStage(AgentRouter agentRouter) {
        this.agentRouter = agentRouter;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.RESOLVE;
    }

    @Override
    public PipelineEvent handle(PipelineContext context) {
        Map<String, BlueprintEntry> entries = context.blueprint().stream()
                .collect(Collectors.toMap(BlueprintEntry::subquestionId, Function.identity(), (first, second) -> first));
        SearchFilters filters = context.filters().withIncludeDocumentIds(context.lastTurnDocumentIds());
        for (SubQuestion subQuestion : context.plan().subquestions()) {
            BlueprintEntry entry = entries.get(subQuestion.id());
            if (entry == null) {
                throw new IllegalStateException("No blueprint entry for sub-question " + subQuestion.id());
            }
            AgentTask task = new AgentTask(subQuestion, entry, filters, context.contextPack(), context.thinking());
            AgentAnswer answer = agentRouter.route(entry.agent(), task);
            context.addAnswer(answer);
        }
        return PipelineEvent.ADVANCE;
    }
}
