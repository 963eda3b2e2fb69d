package com.payerdesk.chatbot.service.retrieval;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

@Component
public class DocumentAssembler {

    private final NeighborExpander neighborExpander;
    private final ExternalSearchFallback fallback;
    private final boolean expandNeighbors;

    public DocumentAssembler(NeighborExpander neighborExpander,
                             ExternalSearchFallback fallback,
                             RetrievalProperties properties) {
        this.neighborExpander = neighborExpander;
        this.fallback = fallback;
        this.expandNeighbors = properties.isNeighborExpansionEnabled();
    }

    /**
     * Assembles the final documents for one sub-question. With no corpus chunks, external search runs only
     * when {@code externalOnEmpty} is set; otherwise the result is {@code no_sources}.
     */
    public AssembledDocuments assemble(List<RetrievalChunk> chunks,
                                       String question,
                                       boolean externalOnEmpty,
                                       Consumer<String> thinking) {
        if (chunks.isEmpty()) {
            if (!externalOnEmpty) {
                return AssembledDocuments.empty();
            }
            thinking.accept("I didn't find anything specific in our materials; checking external sources.");
            return fallback.apply(List.of(), question, thinking);
        }
        List<RetrievalChunk> working = expandNeighbors ? neighborExpander.expand(chunks) : chunks;
        return fallback.apply(working, question, thinking);
    }
}
