package com.payerdesk.chatbot.service.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Appends sibling paragraphs after each kept chunk. Never fails; a broken metadata store means no expansion.
 */
@Component
public class NeighborExpander {

    private static final Logger log = LoggerFactory.getLogger(NeighborExpander.class);

    private final MetadataStore metadataStore;
    private final int window;

    public NeighborExpander(MetadataStore metadataStore, RetrievalProperties properties) {
        this.metadataStore = metadataStore;
        this.window = properties.getNeighborWindow();
    }

    public List<RetrievalChunk> expand(List<RetrievalChunk> chunks) {
        Set<String> seen = new HashSet<>();
        List<RetrievalChunk> expanded = new ArrayList<>();
        for (RetrievalChunk chunk : chunks) {
            if (chunk.id() != null && !seen.add(chunk.id())) {
                continue;
            }
            expanded.add(chunk);
            if (chunk.documentId() == null || chunk.isExternal()) {
                continue;
            }
            int paragraph = chunk.paragraphIndex() == null ? 0 : chunk.paragraphIndex();
            for (MetadataRecord sibling : siblings(chunk, paragraph)) {
                if (sibling.id() != null && seen.add(sibling.id())) {
                    expanded.add(sibling.toChunk(chunk.score(), true));
                }
            }
        }
        return expanded;
    }

    private List<MetadataRecord> siblings(RetrievalChunk chunk, int paragraph) {
        try {
            return metadataStore.fetchSiblings(chunk.documentId(), paragraph, window, chunk.id());
        } catch (RuntimeException ex) {
            log.warn("Neighbor expansion failed for document {}: {}", chunk.documentId(), ex.getMessage());
            return List.of();
        }
    }
}
