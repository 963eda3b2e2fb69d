package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubQuestion(String id,
                          String text,
                          QuestionKind kind,
                          QuestionIntent questionIntent,
                          double intentScore,
                          List<String> onRagFail,
                          String capabilitiesPrimary,
                          boolean requiresJurisdiction) {

    public static final String CAPABILITY_REASONING = "reasoning";
    public static final String CAPABILITY_WEB = "web";
    public static final String ON_RAG_FAIL_EXTERNAL_SEARCH = "external_search";

    public SubQuestion {
        onRagFail = onRagFail == null ? List.of() : List.copyOf(onRagFail);
        intentScore = Math.max(0.0, Math.min(1.0, intentScore));
    }
}
