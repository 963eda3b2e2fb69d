package com.payerdesk.chatbot.service.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.payerdesk.chatbot.service.state.Jurisdiction;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Jurisdiction filters passed through to the search index, plus the documents the previous turn cited
 * so follow-ups stay on the same material.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchFilters(String filterPayer, String filterState, String filterProgram,
                            List<String> includeDocumentIds) {

    public SearchFilters {
        includeDocumentIds = includeDocumentIds == null || includeDocumentIds.isEmpty()
                ? null
                : List.copyOf(includeDocumentIds);
    }

    public SearchFilters(String filterPayer, String filterState, String filterProgram) {
        this(filterPayer, filterState, filterProgram, null);
    }

    public static SearchFilters none() {
        return new SearchFilters(null, null, null);
    }

    public static SearchFilters from(Jurisdiction jurisdiction, UnaryOperator<String> payerCanonicalizer) {
        if (jurisdiction == null) {
            return none();
        }
        String payer = blankToNull(jurisdiction.payor());
        if (payer != null) {
            payer = blankToNull(payerCanonicalizer.apply(payer));
        }
        return new SearchFilters(payer, blankToNull(jurisdiction.state()), blankToNull(jurisdiction.program()));
    }

    public SearchFilters withIncludeDocumentIds(List<String> documentIds) {
        return new SearchFilters(filterPayer, filterState, filterProgram, documentIds);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
