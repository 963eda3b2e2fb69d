package com.payerdesk.chatbot.service.pipeline;

import java.util.Locale;

public enum PipelineStage {
    STATE_LOAD,
    CLASSIFY,
    PLAN,
    CLARIFY,
    RESOLVE,
    INTEGRATE,
    PUBLISH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
