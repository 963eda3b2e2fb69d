package com.payerdesk.chatbot.service.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Vector/lexical search over the published corpus. Distances are cosine in [0, 2] and converted to a similarity.
 */
@Component
public class HttpSearchClient implements SearchClient {

    private static final Logger log = LoggerFactory.getLogger(HttpSearchClient.class);

    private final WebClient searchWebClient;
    private final boolean configured;
    private final String index;
    private final Duration timeout;

    public HttpSearchClient(@Qualifier("searchWebClient") WebClient searchWebClient,
                            @Value("${chat.search.base-url:}") String baseUrl,
                            @Value("${chat.search.index:published_rag}") String index,
                            @Value("${chat.search.timeout-seconds:15}") long timeoutSeconds) {
        this.searchWebClient = searchWebClient;
        this.configured = baseUrl != null && !baseUrl.isBlank();
        this.index = index;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public List<SearchCandidate> search(String query, SearchFilters filters, int k, List<String> sourceTypes) {
        if (!configured) {
            log.debug("Search index not configured; returning no candidates");
            return Collections.emptyList();
        }
        if (k <= 0) {
            return Collections.emptyList();
        }
        SearchPayload payload = new SearchPayload(query, k, filters == null ? SearchFilters.none() : filters,
                sourceTypes == null || sourceTypes.isEmpty() ? null : sourceTypes);
        try {
            SearchResponse response = searchWebClient.post()
                    .uri("/indexes/{index}/search", index)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(SearchResponse.class)
                    .block(timeout);
            if (response == null || response.results() == null) {
                return Collections.emptyList();
            }
            return response.results().stream()
                    .filter(hit -> hit.id() != null && !hit.id().isBlank())
                    .map(Hit::toCandidate)
                    .toList();
        } catch (RuntimeException ex) {
            throw new RetrievalException("Search request failed: " + ex.getMessage(), ex);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    private record SearchPayload(String query, int k, SearchFilters filters, List<String> sourceTypes) {}

    private record SearchResponse(List<Hit> results) {}

    private record Hit(String id, Double score, Double distance) {
        SearchCandidate toCandidate() {
            if (score != null) {
                return new SearchCandidate(id, score);
            }
            if (distance != null) {
                double similarity = Math.max(0.0, Math.min(1.0, 1.0 - distance / 2.0));
                return new SearchCandidate(id, Math.round(similarity * 10_000) / 10_000.0);
            }
            return new SearchCandidate(id, null);
        }
    }
}
