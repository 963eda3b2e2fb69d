package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.service.retrieval.SearchFilters;
import com.payerdesk.chatbot.service.state.ContextRoute;
import com.payerdesk.chatbot.service.state.ContextRouter;
import com.payerdesk.chatbot.service.state.DialogueStateMachine;
import com.payerdesk.chatbot.service.state.MessageClassification;
import com.payerdesk.chatbot.service.state.PayerDirectory;
import com.payerdesk.chatbot.service.state.StateDelta;
import com.payerdesk.chatbot.service.state.StateExtractor;
import com.payerdesk.chatbot.service.state.ThreadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Slot fill or new question, then the state delta, the context route and the resolved jurisdiction.
 */
@Component
public class ClassifyStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ClassifyStage.class);

    private final DialogueStateMachine dialogueStateMachine;
    private final StateExtractor stateExtractor;
    private final ContextRouter contextRouter;
    private final PayerDirectory payerDirectory;

    public ClassifyStage(DialogueStateMachine dialogueStateMachine,
                         StateExtractor stateExtractor,
                         ContextRouter contextRouter,
                         PayerDirectory payerDirectory) {
        this.dialogueStateMachine = dialogueStateMachine;
        this.stateExtractor = stateExtractor;
        this.contextRouter = contextRouter;
        this.payerDirectory = payerDirectory;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.CLASSIFY;
    }

    @Override
    public PipelineEvent handle(PipelineContext context) {
        ThreadState before = context.state();
        MessageClassification classification = dialogueStateMachine.classify(
                context.message(), before.openSlots(), before.refinedQuery());
        context.setClassification(classification);

        StateDelta delta = stateExtractor.extract(context.message(), before, classification);
        ThreadState after = dialogueStateMachine.applyDelta(before, delta);
        context.setState(after);

        ContextRoute route = contextRouter.route(context.message(), after, delta.resetReason().orElse(null));
        context.setRoute(route);
        context.setContextPack(contextRouter.buildPack(route, after, context.lastTurns()));
        context.setJurisdiction(after.active().resolveJurisdiction());
        context.setFilters(SearchFilters.from(context.jurisdiction(), payerDirectory::canonicalize));

        log.debug("Classified {} as {} (route {})", context.correlationId(), classification.wireName(), route);
        if (classification == MessageClassification.SLOT_FILL) {
            context.thinking().accept("Got it, I'll use that to continue your earlier question.");
        }
        return PipelineEvent.ADVANCE;
    }
}
