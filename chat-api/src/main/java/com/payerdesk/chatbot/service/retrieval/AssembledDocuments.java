package com.payerdesk.chatbot.service.retrieval;

import java.util.List;

public record AssembledDocuments(List<RetrievalChunk> chunks, RetrievalSignal signal) {

    public AssembledDocuments {
        chunks = List.copyOf(chunks);
    }

    public static AssembledDocuments empty() {
        return new AssembledDocuments(List.of(), RetrievalSignal.NO_SOURCES);
    }
}
