package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.model.ResponsePayload;
import com.payerdesk.chatbot.service.state.ClarificationPolicy;
import com.payerdesk.chatbot.service.state.ClarificationRequest;
import com.payerdesk.chatbot.service.state.DialogueStateMachine;
import com.payerdesk.chatbot.service.state.QueryRefinementPolicy;
import com.payerdesk.chatbot.service.state.RefinementRequest;
import com.payerdesk.chatbot.service.state.StateDelta;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Jurisdiction clarification first, then query refinement. Either one ends the run early.
 */
@Component
public class ClarifyStage implements StageHandler {

    private final ClarificationPolicy clarificationPolicy;
    private final QueryRefinementPolicy refinementPolicy;
    private final DialogueStateMachine dialogueStateMachine;

    public ClarifyStage(ClarificationPolicy clarificationPolicy,
                        QueryRefinementPolicy refinementPolicy,
                        DialogueStateMachine dialogueStateMachine) {
        this.clarificationPolicy = clarificationPolicy;
        this.refinementPolicy = refinementPolicy;
        this.dialogueStateMachine = dialogueStateMachine;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.CLARIFY;
    }

    @Override
    public PipelineEvent handle(PipelineContext context) {
        Optional<ClarificationRequest> clarification = clarificationPolicy.evaluate(context.plan(), context.jurisdiction());
        if (clarification.isPresent()) {
            ClarificationRequest request = clarification.get();
            context.setState(dialogueStateMachine.applyDelta(context.state(),
                    StateDelta.builder().openSlots(request.missingSlots()).build()));
            context.thinking().accept("I need to know which health plan this is about.");
            context.setPayload(ResponsePayload.clarification(context.correlationId(), context.threadId(),
                    request.message(), request.missingSlots(), request.options(), context.refinedQuery()));
            return PipelineEvent.EARLY_EXIT;
        }

        Optional<RefinementRequest> refinement = refinementPolicy.evaluate(context.plan());
        if (refinement.isPresent()) {
            RefinementRequest request = refinement.get();
            context.thinking().accept("I want to confirm what you're asking before I look it up.");
            context.setPayload(ResponsePayload.refinementAsk(context.correlationId(), context.threadId(),
                    request.message(), request.suggestions(), context.refinedQuery()));
            return PipelineEvent.EARLY_EXIT;
        }
        return PipelineEvent.ADVANCE;
    }
}
