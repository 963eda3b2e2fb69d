package com.payerdesk.chatbot.service.retrieval;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BlendedRetrievalServiceTest {

    private final SearchClient searchClient = mock(SearchClient.class);
    private final MetadataStore metadataStore = mock(MetadataStore.class);
    private final RetrievalProperties properties = new RetrievalProperties();
    private final BlendedRetrievalService service = new BlendedRetrievalService(searchClient, metadataStore, properties);
    private final List<String> thinking = new ArrayList<>();

    @Test
    void unconfiguredSearchReturnsNothing() {
        when(searchClient.isConfigured()).thenReturn(false);

        List<RetrievalChunk> chunks = service.retrieve("q", new RetrievalBlend(5, 0, 0.5), SearchFilters.none(), thinking::add);

        assertThat(chunks).isEmpty();
        assertThat(thinking).containsExactly("I don't have access to our materials right now; I'll answer from what I know.");
        verify(searchClient, never()).search(anyString(), any(), anyInt(), anyList());
    }

    @Test
    void hierarchicalPathSortsByDocumentLevelThenScore() {
        when(searchClient.isConfigured()).thenReturn(true);
        when(searchClient.search(eq("appeals"), any(), eq(2), eq(BlendedRetrievalService.HIERARCHICAL_TYPES)))
                .thenReturn(List.of(new SearchCandidate("a", 0.9), new SearchCandidate("b", 0.6)));
        when(metadataStore.fetchByIds(List.of("a", "b"))).thenReturn(List.of(
                record("a", "section"), record("b", "policy")));

        List<RetrievalChunk> chunks = service.retrieve("appeals", new RetrievalBlend(2, 0, 0.5), SearchFilters.none(), thinking::add);

        assertThat(chunks).extracting(RetrievalChunk::id).containsExactly("b", "a");
        assertThat(chunks).extracting(RetrievalChunk::score).containsExactly(0.6, 0.9);
        assertThat(thinking).containsExactly("Searching our materials...");
    }

    @Test
    void emptyTypeRestrictedSearchFallsBackToSuperset() {
        when(searchClient.isConfigured()).thenReturn(true);
        when(searchClient.search(eq("appeals"), any(), eq(2), eq(BlendedRetrievalService.HIERARCHICAL_TYPES)))
                .thenReturn(List.of());
        when(searchClient.search(eq("appeals"), any(), eq(4), eq(List.of())))
                .thenReturn(List.of(new SearchCandidate("f", 0.95), new SearchCandidate("c", 0.7), new SearchCandidate("p", 0.4)));
        when(metadataStore.fetchByIds(List.of("f", "c", "p"))).thenReturn(List.of(
                record("f", "fact"), record("c", "chunk"), record("p", "policy")));

        List<RetrievalChunk> chunks = service.retrieve("appeals", new RetrievalBlend(2, 0, 0.5), SearchFilters.none(), thinking::add);

        assertThat(chunks).extracting(RetrievalChunk::id).containsExactly("p", "c");
    }

    @Test
    void factualPathDropsHitsBelowConfidenceFloor() {
        when(searchClient.isConfigured()).thenReturn(true);
        when(searchClient.search(eq("deadline"), any(), eq(3), eq(List.of())))
                .thenReturn(List.of(new SearchCandidate("x", 0.82), new SearchCandidate("y", 0.4)));
        when(metadataStore.fetchByIds(List.of("x", "y"))).thenReturn(List.of(record("x", "fact"), record("y", "fact")));

        List<RetrievalChunk> chunks = service.retrieve("deadline", new RetrievalBlend(0, 3, 0.8), SearchFilters.none(), thinking::add);

        assertThat(chunks).extracting(RetrievalChunk::id).containsExactly("x");
    }

    @Test
    void searchFailureYieldsEmptyPath() {
        when(searchClient.isConfigured()).thenReturn(true);
        when(searchClient.search(anyString(), any(), anyInt(), anyList())).thenThrow(new RetrievalException("index down"));

        assertThat(service.retrieve("q", new RetrievalBlend(0, 3, 0.8), SearchFilters.none(), thinking::add)).isEmpty();
    }

    @Test
    void mergeKeepsFirstOccurrence() {
        RetrievalChunk first = chunk("a", 0.9);
        RetrievalChunk duplicate = chunk("a", 0.2);
        RetrievalChunk other = chunk("b", 0.5);

        assertThat(BlendedRetrievalService.merge(List.of(first), List.of(duplicate, other)))
                .containsExactly(first, other);
    }

    private static MetadataRecord record(String id, String sourceType) {
        return new MetadataRecord(id, "doc-" + id, "Provider Manual", sourceType, "text " + id, 1, 0);
    }

    private static RetrievalChunk chunk(String id, double score) {
        return new RetrievalChunk(id, "text", "d", "Doc", null, null, "chunk", score, null, null, false);
    }
}
