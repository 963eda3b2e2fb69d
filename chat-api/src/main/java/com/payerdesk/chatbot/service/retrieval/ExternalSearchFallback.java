package com.payerdesk.chatbot.service.retrieval;

import com.payerdesk.chatbot.service.skills.ExternalSearchSkill;
import com.payerdesk.chatbot.service.skills.SearchSnippet;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Decides, from the best corpus score, whether external search complements or replaces the corpus.
 */
@Component
public class ExternalSearchFallback {

    public static final String EXTERNAL_GUIDANCE =
            "External source; use if helpful but retain/hedge; not from authoritative corpus.";

    private static final Logger log = LoggerFactory.getLogger(ExternalSearchFallback.class);

    private final ExternalSearchSkill searchSkill;
    private final ConfidenceAssigner confidenceAssigner;
    private final MeterRegistry meterRegistry;
    private final double confidentMin;
    private final double lowMatchMin;
    private final int maxResults;

    public ExternalSearchFallback(ExternalSearchSkill searchSkill,
                                  ConfidenceAssigner confidenceAssigner,
                                  MeterRegistry meterRegistry,
                                  RetrievalProperties properties) {
        this.searchSkill = searchSkill;
        this.confidenceAssigner = confidenceAssigner;
        this.meterRegistry = meterRegistry;
        this.confidentMin = properties.getConfidentMin();
        this.lowMatchMin = properties.getFallbackLowMatchMin();
        this.maxResults = properties.getExternalMaxResults();
    }

    public AssembledDocuments apply(List<RetrievalChunk> chunks, String question, Consumer<String> thinking) {
        List<RetrievalChunk> labelled = confidenceAssigner.assignAll(chunks);
        double best = bestScore(labelled);
        List<RetrievalChunk> kept = labelled.stream()
                .filter(chunk -> chunk.confidenceLabel() != ConfidenceLabel.ABSTAIN)
                .toList();

        AssembledDocuments result;
        if (best >= confidentMin) {
            thinking.accept("Corpus confidence sufficient; using retrieved docs only.");
            result = new AssembledDocuments(kept, RetrievalSignal.CORPUS_ONLY);
        } else if (best >= lowMatchMin) {
            thinking.accept("Adding external search to complement corpus...");
            List<RetrievalChunk> combined = new ArrayList<>(kept);
            combined.addAll(externalSearch(question));
            result = new AssembledDocuments(combined, RetrievalSignal.CORPUS_PLUS_GOOGLE);
        } else {
            thinking.accept("Low corpus confidence; using external search.");
            List<RetrievalChunk> external = externalSearch(question);
            if (!external.isEmpty()) {
                result = new AssembledDocuments(external, RetrievalSignal.GOOGLE_ONLY);
            } else if (!kept.isEmpty()) {
                result = new AssembledDocuments(kept, RetrievalSignal.GOOGLE_ONLY);
            } else {
                result = AssembledDocuments.empty();
            }
        }
        meterRegistry.counter("chat.retrieval.signal", "signal", result.signal().wireName()).increment();
        return result;
    }

    static double bestScore(List<RetrievalChunk> chunks) {
        return chunks.stream().mapToDouble(RetrievalChunk::scoreOrZero).max().orElse(0.0);
    }

    List<RetrievalChunk> externalSearch(String question) {
        try {
            List<SearchSnippet> snippets = searchSkill.search(question, maxResults);
            List<RetrievalChunk> chunks = new ArrayList<>();
            for (int i = 0; i < snippets.size() && i < maxResults; i++) {
                chunks.add(toChunk(snippets.get(i), i));
            }
            return chunks;
        } catch (RuntimeException ex) {
            log.warn("External search fallback failed: {}", ex.getMessage());
            return List.of();
        }
    }

    public static RetrievalChunk toChunk(SearchSnippet snippet, int position) {
        String id = snippet.url() != null && !snippet.url().isBlank()
                ? "external:" + snippet.url()
                : "external:" + position;
        return new RetrievalChunk(id, snippet.text(), null, snippet.displayName(), null, null,
                RetrievalChunk.SOURCE_TYPE_EXTERNAL, 0.0, ConfidenceLabel.ABSTAIN, EXTERNAL_GUIDANCE, false);
    }
}
