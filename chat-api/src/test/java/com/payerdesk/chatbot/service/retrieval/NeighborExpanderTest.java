package com.payerdesk.chatbot.service.retrieval;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NeighborExpanderTest {

    private final MetadataStore metadataStore = mock(MetadataStore.class);
    private final NeighborExpander expander = new NeighborExpander(metadataStore, new RetrievalProperties());

    @Test
    void appendsSiblingsAfterEachChunkWithoutDuplicates() {
        when(metadataStore.fetchSiblings(eq("d1"), eq(3), eq(2), eq("c1"))).thenReturn(List.of(
                new MetadataRecord("s1", "d1", "Manual", "chunk", "sibling", 1, 2),
                new MetadataRecord("c2", "d1", "Manual", "chunk", "already retrieved", 1, 4)));

        List<RetrievalChunk> expanded = expander.expand(List.of(
                chunk("c1", "d1", 3, 0.8),
                chunk("c2", "d1", 4, 0.7)));

        assertThat(expanded).extracting(RetrievalChunk::id).containsExactly("c1", "s1", "c2");
        assertThat(expanded.get(1).neighbor()).isTrue();
        assertThat(expanded.get(1).score()).isEqualTo(0.8);
        verify(metadataStore, never()).fetchSiblings(eq("d1"), eq(4), anyInt(), eq("c2"));
    }

    @Test
    void metadataFailureKeepsOriginalChunks() {
        when(metadataStore.fetchSiblings(anyString(), anyInt(), anyInt(), anyString()))
                .thenThrow(new RetrievalException("metadata unavailable"));

        List<RetrievalChunk> expanded = expander.expand(List.of(chunk("c1", "d1", 0, 0.9)));

        assertThat(expanded).extracting(RetrievalChunk::id).containsExactly("c1");
    }

    @Test
    void externalChunksAreNotExpanded() {
        RetrievalChunk external = new RetrievalChunk("external:0", "text", "d9", "Site", null, null,
                RetrievalChunk.SOURCE_TYPE_EXTERNAL, 0.0, ConfidenceLabel.ABSTAIN, ExternalSearchFallback.EXTERNAL_GUIDANCE, false);

        assertThat(expander.expand(List.of(external))).containsExactly(external);
        verify(metadataStore, never()).fetchSiblings(anyString(), anyInt(), anyInt(), anyString());
    }

    private static RetrievalChunk chunk(String id, String documentId, int paragraph, double score) {
        return new RetrievalChunk(id, "text " + id, documentId, "Manual", 1, paragraph, "chunk", score, null, null, false);
    }
}
