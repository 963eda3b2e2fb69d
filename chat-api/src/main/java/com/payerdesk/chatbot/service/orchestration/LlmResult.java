package com.payerdesk.chatbot.service.orchestration;

public record LlmResult(String text, LlmUsage usage) {
}
