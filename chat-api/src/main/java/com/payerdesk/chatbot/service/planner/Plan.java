package com.payerdesk.chatbot.service.planner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.payerdesk.chatbot.service.orchestration.LlmUsage;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Plan(List<SubQuestion> subquestions, List<String> thinkingLog, LlmUsage llmUsage) {

    public Plan {
        subquestions = subquestions == null ? List.of() : List.copyOf(subquestions);
        thinkingLog = thinkingLog == null ? List.of() : List.copyOf(thinkingLog);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return subquestions.isEmpty();
    }
}
