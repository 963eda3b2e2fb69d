package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.service.planner.AgentType;
import org.springframework.stereotype.Component;

@Component
public class PatientStubAgent implements AnsweringAgent {

    static final String REFUSAL = "I don't have access to your personal records yet.";

    @Override
    public AgentType type() {
        return AgentType.PATIENT_STUB;
    }

    @Override
    public AgentAnswer answer(AgentTask task) {
        return AgentAnswer.withoutSources(task.subQuestion().id(), REFUSAL, null);
    }
}
