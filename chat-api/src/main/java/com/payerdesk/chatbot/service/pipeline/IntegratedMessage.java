package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.service.orchestration.LlmUsage;

/**
 * Final user-facing text. {@code usage} is null when no integrator call was made.
 */
public record IntegratedMessage(String text, LlmUsage usage) {
}
