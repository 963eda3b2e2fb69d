package com.payerdesk.chatbot.service.planner;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives one execution directive per sub-question. Pure function of the plan.
 */
@Component
public class BlueprintBuilder {

    public static final String RETRIEVAL_CONFIG_STANDARD = "standard";

    private final int defaultRagK;

    public BlueprintBuilder(PlannerProperties properties) {
        this.defaultRagK = properties.getDefaultRagK();
    }

    public List<BlueprintEntry> build(Plan plan) {
        return plan.subquestions().stream().map(this::entryFor).toList();
    }

    BlueprintEntry entryFor(SubQuestion subQuestion) {
        AgentType agent = agentFor(subQuestion);
        Integer ragK = agent == AgentType.RAG ? defaultRagK : null;
        String retrievalConfig = agent == AgentType.RAG ? RETRIEVAL_CONFIG_STANDARD : null;
        return new BlueprintEntry(subQuestion.id(), agent, sensitivityFor(subQuestion), ragK, retrievalConfig,
                subQuestion.text(), subQuestion.onRagFail());
    }

    static AgentType agentFor(SubQuestion subQuestion) {
        if (subQuestion.kind() == QuestionKind.PATIENT) {
            return AgentType.PATIENT_STUB;
        }
        if (SubQuestion.CAPABILITY_REASONING.equals(subQuestion.capabilitiesPrimary())) {
            return AgentType.REASONING;
        }
        if (subQuestion.kind() == QuestionKind.TOOL || SubQuestion.CAPABILITY_WEB.equals(subQuestion.capabilitiesPrimary())) {
            return AgentType.TOOL;
        }
        return AgentType.RAG;
    }

    static Sensitivity sensitivityFor(SubQuestion subQuestion) {
        if (subQuestion.kind() == QuestionKind.PATIENT) {
            return Sensitivity.HIGH;
        }
        if (subQuestion.questionIntent() == QuestionIntent.FACTUAL) {
            return Sensitivity.MEDIUM;
        }
        return Sensitivity.LOW;
    }
}
