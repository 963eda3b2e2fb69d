package com.payerdesk.chatbot.service.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Two-path corpus retrieval: hierarchical passages for process questions, factual passages for lookups.
 * Search and metadata failures are contained here and yield an empty path.
 */
@Service
public class BlendedRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(BlendedRetrievalService.class);

    static final List<String> SOURCE_TYPE_ORDER = List.of("policy", "section", "chunk", "hierarchical", "fact");
    static final List<String> HIERARCHICAL_TYPES = SOURCE_TYPE_ORDER.subList(0, 4);

    private final SearchClient searchClient;
    private final MetadataStore metadataStore;
    private final RetrievalProperties properties;

    public BlendedRetrievalService(SearchClient searchClient,
                                   MetadataStore metadataStore,
                                   RetrievalProperties properties) {
        this.searchClient = searchClient;
        this.metadataStore = metadataStore;
        this.properties = properties;
    }

    public List<RetrievalChunk> retrieve(String question,
                                         RetrievalBlend blend,
                                         SearchFilters filters,
                                         Consumer<String> thinking) {
        if (!searchClient.isConfigured()) {
            thinking.accept("I don't have access to our materials right now; I'll answer from what I know.");
            return List.of();
        }
        thinking.accept("Searching our materials...");
        if (blend.total() == 0) {
            return factual(question, properties.getDefaultTopK(), null, filters);
        }
        List<RetrievalChunk> hierarchical = blend.nHierarchical() > 0
                ? hierarchical(question, blend.nHierarchical(), filters)
                : List.of();
        List<RetrievalChunk> factual = blend.nFactual() > 0
                ? factual(question, blend.nFactual(), blend.confidenceMin(), filters)
                : List.of();
        List<RetrievalChunk> merged = merge(hierarchical, factual);
        log.debug("Retrieved {} hierarchical and {} factual chunk(s), {} after merge",
                hierarchical.size(), factual.size(), merged.size());
        return merged;
    }

    /**
     * Concatenates both paths and keeps the first occurrence of each id.
     */
    static List<RetrievalChunk> merge(List<RetrievalChunk> hierarchical, List<RetrievalChunk> factual) {
        Map<String, RetrievalChunk> byId = new LinkedHashMap<>();
        List<RetrievalChunk> withoutId = new ArrayList<>();
        for (List<RetrievalChunk> path : List.of(hierarchical, factual)) {
            for (RetrievalChunk chunk : path) {
                if (chunk.id() == null || chunk.id().isBlank()) {
                    withoutId.add(chunk);
                } else {
                    byId.putIfAbsent(chunk.id(), chunk);
                }
            }
        }
        List<RetrievalChunk> merged = new ArrayList<>(byId.values());
        merged.addAll(withoutId);
        return merged;
    }

    static int hierarchyRank(String sourceType) {
        String type = sourceType == null ? "chunk" : sourceType.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < SOURCE_TYPE_ORDER.size(); i++) {
            String candidate = SOURCE_TYPE_ORDER.get(i);
            if (type.equals(candidate) || type.startsWith(candidate)) {
                return i;
            }
        }
        return SOURCE_TYPE_ORDER.size();
    }

    static List<RetrievalChunk> sortByHierarchy(List<RetrievalChunk> chunks, int limit) {
        return chunks.stream()
                .sorted(Comparator.comparingInt((RetrievalChunk chunk) -> hierarchyRank(chunk.sourceType()))
                        .thenComparing(Comparator.comparingDouble(RetrievalChunk::scoreOrZero).reversed()))
                .limit(limit)
                .toList();
    }

    private List<RetrievalChunk> hierarchical(String question, int n, SearchFilters filters) {
        if (properties.isTypeFilterSupported()) {
            List<RetrievalChunk> restricted = fetch(question, filters, n, HIERARCHICAL_TYPES);
            if (!restricted.isEmpty()) {
                return sortByHierarchy(restricted, n);
            }
            log.debug("Type-restricted search returned nothing; sorting an unrestricted superset");
        }
        int superset = Math.max(n * Math.max(2, properties.getSupersetFactor()), n);
        return sortByHierarchy(fetch(question, filters, superset, List.of()), n);
    }

    private List<RetrievalChunk> factual(String question, int k, Double confidenceMin, SearchFilters filters) {
        List<RetrievalChunk> chunks = fetch(question, filters, k, List.of());
        if (confidenceMin == null) {
            return chunks;
        }
        return chunks.stream().filter(chunk -> chunk.scoreOrZero() >= confidenceMin).toList();
    }

    private List<RetrievalChunk> fetch(String question, SearchFilters filters, int k, List<String> sourceTypes) {
        try {
            List<SearchCandidate> candidates = searchClient.search(question, filters, k, sourceTypes);
            if (candidates.isEmpty()) {
                return List.of();
            }
            Map<String, Double> scores = new LinkedHashMap<>();
            candidates.forEach(candidate -> scores.putIfAbsent(candidate.id(), candidate.score()));
            Map<String, MetadataRecord> records = new LinkedHashMap<>();
            for (MetadataRecord record : metadataStore.fetchByIds(new ArrayList<>(scores.keySet()))) {
                records.put(record.id(), record);
            }
            List<RetrievalChunk> chunks = new ArrayList<>();
            for (Map.Entry<String, Double> entry : scores.entrySet()) {
                MetadataRecord record = records.get(entry.getKey());
                if (record != null) {
                    chunks.add(record.toChunk(entry.getValue(), false));
                }
            }
            return chunks;
        } catch (RetrievalException ex) {
            log.warn("Retrieval failed: {}", ex.getMessage());
            return List.of();
        }
    }
}
