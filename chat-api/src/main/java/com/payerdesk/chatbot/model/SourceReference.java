package com.payerdesk.chatbot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SourceReference(int index,
                              String documentId,
                              String documentName,
                              Integer pageNumber,
                              String sourceType,
                              Double matchScore,
                              String confidenceLabel,
                              String llmGuidance,
                              String text) {

    public SourceReference withIndex(int newIndex) {
        return new SourceReference(newIndex, documentId, documentName, pageNumber, sourceType, matchScore,
                confidenceLabel, llmGuidance, text);
    }

    public SourceReference withText(String newText) {
        return new SourceReference(index, documentId, documentName, pageNumber, sourceType, matchScore,
                confidenceLabel, llmGuidance, newText);
    }
}
