package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Terminal artifact of one pipeline run. Written once per correlation id, read by any number of pollers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResponsePayload(String correlationId,
                              ResponseStatus status,
                              String message,
                              List<SourceReference> sources,
                              double cost,
                              String threadId,
                              List<Integer> citedSourceIndices,
                              List<String> openSlots,
                              List<ClarificationOption> clarificationOptions,
                              List<String> suggestions,
                              String sourceConfidenceStrip,
                              List<String> retrievalSignals,
                              TokenTotals usage,
                              List<UsageBreakdownEntry> usageBreakdown,
                              String modelUsed,
                              String refinedQuery) implements PollResult {

    public ResponsePayload {
        sources = sources == null ? List.of() : List.copyOf(sources);
        citedSourceIndices = citedSourceIndices == null ? List.of() : List.copyOf(citedSourceIndices);
    }

    public static ResponsePayload clarification(String correlationId,
                                                String threadId,
                                                String message,
                                                List<String> openSlots,
                                                List<ClarificationOption> options,
                                                String refinedQuery) {
        return new ResponsePayload(correlationId, ResponseStatus.CLARIFICATION, message, List.of(), 0.0, threadId,
                List.of(), List.copyOf(openSlots), List.copyOf(options), null, null, null,
                TokenTotals.empty(), List.of(), null, refinedQuery);
    }

    public static ResponsePayload refinementAsk(String correlationId,
                                                String threadId,
                                                String message,
                                                List<String> suggestions,
                                                String refinedQuery) {
        return new ResponsePayload(correlationId, ResponseStatus.REFINEMENT_ASK, message, List.of(), 0.0, threadId,
                List.of(), null, null, List.copyOf(suggestions), null, null,
                TokenTotals.empty(), List.of(), null, refinedQuery);
    }

    public static ResponsePayload failed(String correlationId, String threadId, String message) {
        return new ResponsePayload(correlationId, ResponseStatus.FAILED, message, List.of(), 0.0, threadId,
                List.of(), null, null, null, null, null, TokenTotals.empty(), List.of(), null, null);
    }
}
