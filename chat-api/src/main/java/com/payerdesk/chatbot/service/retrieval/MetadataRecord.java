package com.payerdesk.chatbot.service.retrieval;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetadataRecord(String id,
                             String documentId,
                             String documentName,
                             String sourceType,
                             String text,
                             Integer pageNumber,
                             Integer paragraphIndex) {

    RetrievalChunk toChunk(Double score, boolean neighbor) {
        String name = documentName == null || documentName.isBlank() ? "document" : documentName;
        String type = sourceType == null || sourceType.isBlank() ? "chunk" : sourceType;
        return new RetrievalChunk(id, text == null ? "" : text, documentId, name, pageNumber, paragraphIndex, type,
                score, null, null, neighbor);
    }
}
