package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BlueprintEntry(String subquestionId,
                             AgentType agent,
                             Sensitivity sensitivity,
                             Integer ragK,
                             String retrievalConfig,
                             String reframedText,
                             List<String> onRagFail) {

    public BlueprintEntry {
        onRagFail = onRagFail == null ? List.of() : List.copyOf(onRagFail);
    }
}
