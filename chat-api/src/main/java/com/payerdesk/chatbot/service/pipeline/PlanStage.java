package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.service.planner.BlueprintBuilder;
import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.planner.PlanStore;
import com.payerdesk.chatbot.service.planner.QueryPlanner;
import com.payerdesk.chatbot.service.state.DialogueStateMachine;
import com.payerdesk.chatbot.service.state.MessageClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes the refined query, decomposes the effective question and derives the blueprint.
 * A slot fill plans against the refined query it completes.
 */
@Component
public class PlanStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(PlanStage.class);

    private final DialogueStateMachine dialogueStateMachine;
    private final QueryPlanner queryPlanner;
    private final BlueprintBuilder blueprintBuilder;
    private final PlanStore planStore;

    public PlanStage(DialogueStateMachine dialogueStateMachine,
                     QueryPlanner queryPlanner,
                     BlueprintBuilder blueprintBuilder,
                     PlanStore planStore) {
        this.dialogueStateMachine = dialogueStateMachine;
        this.queryPlanner = queryPlanner;
        this.blueprintBuilder = blueprintBuilder;
        this.planStore = planStore;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.PLAN;
    }

    @Override
    public PipelineEvent handle(PipelineContext context) {
        String prior = context.priorRefinedQuery();
        String refined = dialogueStateMachine.computeRefinedQuery(context.classification(), context.message(),
                prior, context.message(), context.jurisdiction());
        context.setRefinedQuery(refined);

        boolean continuesPrior = context.classification() == MessageClassification.SLOT_FILL
                && prior != null && !prior.isBlank();
        String planningText = continuesPrior ? refined : context.message();

        Plan plan;
        try {
            plan = queryPlanner.plan(planningText, context.contextPack(), context.thinking());
            if (plan.isEmpty()) {
                plan = queryPlanner.minimalPlan(planningText);
            }
        } catch (RuntimeException ex) {
            log.warn("Planning failed for {}, using a single-question plan: {}", context.correlationId(), ex.getMessage());
            plan = queryPlanner.minimalPlan(planningText);
        }
        context.setPlan(plan);
        context.setBlueprint(blueprintBuilder.build(plan));
        planStore.store(context.correlationId(), plan);
        return PipelineEvent.ADVANCE;
    }
}
