package com.payerdesk.chatbot.service.pipeline;

public enum PipelineEvent {
    ADVANCE,
    EARLY_EXIT,
    FAIL
}
