package com.payerdesk.chatbot.service.retrieval;

public record RetrievalChunk(String id,
                             String text,
                             String documentId,
                             String documentName,
                             Integer pageNumber,
                             Integer paragraphIndex,
                             String sourceType,
                             Double score,
                             ConfidenceLabel confidenceLabel,
                             String llmGuidance,
                             boolean neighbor) {

    public static final String SOURCE_TYPE_EXTERNAL = "external";

    public double scoreOrZero() {
        return score == null ? 0.0 : score;
    }

    public RetrievalChunk withConfidence(ConfidenceLabel label, String guidance) {
        return new RetrievalChunk(id, text, documentId, documentName, pageNumber, paragraphIndex, sourceType, score,
                label, guidance, neighbor);
    }

    public boolean isExternal() {
        return SOURCE_TYPE_EXTERNAL.equals(sourceType);
    }
}
