package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.service.memory.ConversationStore;
import com.payerdesk.chatbot.service.state.ThreadState;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class StateLoadStage implements StageHandler {

    private final ConversationStore conversationStore;
    private final int contextTurns;

    public StateLoadStage(ConversationStore conversationStore,
                          @Value("${chat.context.turns:2}") int contextTurns) {
        this.conversationStore = conversationStore;
        this.contextTurns = Math.max(0, contextTurns);
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.STATE_LOAD;
    }

    @Override
    public PipelineEvent handle(PipelineContext context) {
        ThreadState state = conversationStore.loadState(context.threadId()).orElseGet(ThreadState::empty);
        context.setState(state);
        context.setPriorRefinedQuery(state.refinedQuery());
        context.setLastTurns(conversationStore.lastTurns(context.threadId(), contextTurns));
        return PipelineEvent.ADVANCE;
    }
}
