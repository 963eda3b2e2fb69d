package com.payerdesk.chatbot.service.retrieval;

import com.payerdesk.chatbot.service.skills.ExternalSearchSkill;
import com.payerdesk.chatbot.service.skills.SearchSnippet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DocumentAssemblerTest {

    private final ExternalSearchSkill searchSkill = mock(ExternalSearchSkill.class);
    private final MetadataStore metadataStore = mock(MetadataStore.class);

    @Test
    void emptyCorpusWithoutFallbackHasNoSources() {
        DocumentAssembler assembler = assembler(new RetrievalProperties());

        AssembledDocuments documents = assembler.assemble(List.of(), "q", false, line -> { });

        assertThat(documents).isEqualTo(AssembledDocuments.empty());
        verifyNoInteractions(searchSkill);
    }

    @Test
    void emptyCorpusWithFallbackSearchesExternally() {
        when(searchSkill.search(anyString(), anyInt())).thenReturn(List.of(new SearchSnippet("Title", "body", "https://x.example")));

        AssembledDocuments documents = assembler(new RetrievalProperties()).assemble(List.of(), "q", true, line -> { });

        assertThat(documents.signal()).isEqualTo(RetrievalSignal.GOOGLE_ONLY);
        assertThat(documents.chunks()).hasSize(1);
    }

    @Test
    void expandsNeighborsWhenEnabled() {
        RetrievalProperties properties = new RetrievalProperties();
        properties.setNeighborExpansionEnabled(true);
        when(metadataStore.fetchSiblings(eq("doc-a"), eq(4), eq(2), eq("a")))
                .thenReturn(List.of(new MetadataRecord("a-next", "doc-a", "Manual", "chunk", "next paragraph", 1, 5)));

        AssembledDocuments documents = assembler(properties).assemble(
                List.of(new RetrievalChunk("a", "text", "doc-a", "Manual", 1, 4, "chunk", 0.9, null, null, false)),
                "q", true, line -> { });

        assertThat(documents.signal()).isEqualTo(RetrievalSignal.CORPUS_ONLY);
        assertThat(documents.chunks()).extracting(RetrievalChunk::id).containsExactly("a", "a-next");
        assertThat(documents.chunks().get(1).neighbor()).isTrue();
    }

    private DocumentAssembler assembler(RetrievalProperties properties) {
        ExternalSearchFallback fallback = new ExternalSearchFallback(searchSkill, new ConfidenceAssigner(properties),
                new SimpleMeterRegistry(), properties);
        return new DocumentAssembler(new NeighborExpander(metadataStore, properties), fallback, properties);
    }
}
