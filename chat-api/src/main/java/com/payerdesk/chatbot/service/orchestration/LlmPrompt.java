package com.payerdesk.chatbot.service.orchestration;

public record LlmPrompt(String systemPrompt, String userPrompt, boolean jsonResponse) {

    public static LlmPrompt of(String systemPrompt, String userPrompt) {
        return new LlmPrompt(systemPrompt, userPrompt, false);
    }

    public static LlmPrompt json(String systemPrompt, String userPrompt) {
        return new LlmPrompt(systemPrompt, userPrompt, true);
    }
}
