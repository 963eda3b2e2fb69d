package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UsageBreakdownEntry(String stage,
                                  String provider,
                                  String model,
                                  int inputTokens,
                                  int outputTokens,
                                  double cost) {
}
