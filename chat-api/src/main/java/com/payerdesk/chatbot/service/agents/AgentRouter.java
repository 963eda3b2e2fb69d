package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.config.MissingConfigurationException;
import com.payerdesk.chatbot.service.planner.AgentType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a sub-question to the agent its blueprint entry names. Every {@link AgentType} must have an agent.
 */
@Component
public class AgentRouter {

    private static final int SNIPPET_LENGTH = 60;

    private final Map<AgentType, AnsweringAgent> agents = new EnumMap<>(AgentType.class);

    public AgentRouter(List<AnsweringAgent> agents) {
        for (AnsweringAgent agent : agents) {
            this.agents.put(agent.type(), agent);
        }
        for (AgentType type : AgentType.values()) {
            if (!this.agents.containsKey(type)) {
                throw new MissingConfigurationException("No answering agent registered for " + type.wireName());
            }
        }
    }

    public AgentAnswer route(AgentType type, AgentTask task) {
        String snippet = snippet(task.questionText());
        String line = switch (type) {
            case PATIENT_STUB -> "This part is about your own info, which I can't access yet.";
            case REASONING -> "Thinking through this: \"" + snippet + "\"";
            case TOOL -> "Checking capabilities: \"" + snippet + "\"";
            case RAG -> "Answering this part: \"" + snippet + "\"";
        };
        task.thinking().accept(line);
        return agents.get(type).answer(task);
    }

    static String snippet(String text) {
        String value = text == null ? "" : text;
        return value.length() > SNIPPET_LENGTH ? value.substring(0, SNIPPET_LENGTH) + "..." : value;
    }
}
