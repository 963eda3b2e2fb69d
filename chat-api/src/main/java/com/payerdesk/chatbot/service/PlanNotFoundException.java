package com.payerdesk.chatbot.service;

public class PlanNotFoundException extends RuntimeException {

    public PlanNotFoundException(String correlationId) {
        super("No plan found for " + correlationId);
    }
}
