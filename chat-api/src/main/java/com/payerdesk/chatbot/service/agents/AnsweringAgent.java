package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.service.planner.AgentType;

/**
 * One answering strategy. Implementations contain their own failures and always return an answer.
 */
public interface AnsweringAgent {

    AgentType type();

    AgentAnswer answer(AgentTask task);
}
