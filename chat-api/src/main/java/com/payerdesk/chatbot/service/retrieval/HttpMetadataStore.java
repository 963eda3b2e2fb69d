package com.payerdesk.chatbot.service.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Component
public class HttpMetadataStore implements MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(HttpMetadataStore.class);
    private static final ParameterizedTypeReference<List<MetadataRecord>> RECORD_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient metadataWebClient;
    private final boolean configured;
    private final Duration timeout;

    public HttpMetadataStore(@Qualifier("metadataWebClient") WebClient metadataWebClient,
                             @Value("${chat.metadata.base-url:}") String baseUrl,
                             @Value("${chat.metadata.timeout-seconds:15}") long timeoutSeconds) {
        this.metadataWebClient = metadataWebClient;
        this.configured = baseUrl != null && !baseUrl.isBlank();
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public List<MetadataRecord> fetchByIds(List<String> ids) {
        if (!configured || ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            List<MetadataRecord> records = metadataWebClient.post()
                    .uri("/records/batch")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("ids", ids))
                    .retrieve()
                    .bodyToMono(RECORD_LIST)
                    .block(timeout);
            if (records == null) {
                return Collections.emptyList();
            }
            if (records.size() < ids.size()) {
                log.warn("Metadata store returned {} record(s) for {} id(s)", records.size(), ids.size());
            }
            return records;
        } catch (RuntimeException ex) {
            throw new RetrievalException("Metadata fetch failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<MetadataRecord> fetchSiblings(String documentId, int paragraphIndex, int window, String excludeId) {
        if (!configured || documentId == null) {
            return Collections.emptyList();
        }
        int from = Math.max(0, paragraphIndex - window);
        int to = paragraphIndex + window;
        try {
            List<MetadataRecord> records = metadataWebClient.get()
                    .uri(uri -> uri.path("/documents/{documentId}/paragraphs")
                            .queryParam("from", from)
                            .queryParam("to", to)
                            .build(documentId))
                    .retrieve()
                    .bodyToMono(RECORD_LIST)
                    .block(timeout);
            if (records == null) {
                return Collections.emptyList();
            }
            return records.stream()
                    .filter(record -> excludeId == null || !excludeId.equals(record.id()))
                    .toList();
        } catch (RuntimeException ex) {
            throw new RetrievalException("Sibling fetch failed: " + ex.getMessage(), ex);
        }
    }
}
