package com.payerdesk.chatbot.service;

import com.payerdesk.chatbot.model.ChatAccepted;
import com.payerdesk.chatbot.model.ChatRequest;
import com.payerdesk.chatbot.model.PollResult;
import com.payerdesk.chatbot.service.planner.Plan;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

public interface ChatService {

    ChatAccepted submit(ChatRequest request, String userId);

    PollResult poll(String correlationId);

    Flux<ServerSentEvent<String>> stream(String correlationId);

    /**
     * @throws PlanNotFoundException when no plan is kept for the id
     */
    Plan plan(String correlationId);
}
