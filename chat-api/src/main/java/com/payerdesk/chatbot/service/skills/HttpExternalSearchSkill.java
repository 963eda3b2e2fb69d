package com.payerdesk.chatbot.service.skills;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Calls the shared skills service: {@code GET /search?q=} and {@code POST /scrape/review}.
 */
@Component
public class HttpExternalSearchSkill implements ExternalSearchSkill {

    static final String SEARCH = "web_search";
    static final String SCRAPE = "web_scrape";

    private static final Logger log = LoggerFactory.getLogger(HttpExternalSearchSkill.class);

    private final WebClient skillsWebClient;
    private final SkillAuditService auditService;
    private final boolean configured;
    private final Duration timeout;

    public HttpExternalSearchSkill(@Qualifier("skillsWebClient") WebClient skillsWebClient,
                                   SkillAuditService auditService,
                                   @Value("${chat.skills.base-url:}") String baseUrl,
                                   @Value("${chat.skills.timeout-seconds:30}") long timeoutSeconds) {
        this.skillsWebClient = skillsWebClient;
        this.auditService = auditService;
        this.configured = baseUrl != null && !baseUrl.isBlank();
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public List<SearchSnippet> search(String query, int maxResults) {
        if (!configured) {
            auditService.skipped(SEARCH, "skills endpoint not configured");
            return Collections.emptyList();
        }
        SearchResponse response = skillsWebClient.get()
                .uri(uri -> uri.path("/search").queryParam("q", query).build())
                .retrieve()
                .bodyToMono(SearchResponse.class)
                .timeout(timeout)
                .onErrorResume(throwable -> {
                    log.warn("External search failed: {}", throwable.getMessage());
                    auditService.record(SEARCH, query, false, 0);
                    return Mono.empty();
                })
                .block();
        if (response == null) {
            return Collections.emptyList();
        }
        List<SearchSnippet> snippets = response.snippets().stream()
                .filter(snippet -> hasText(snippet.snippet()) || hasText(snippet.title()))
                .limit(Math.max(0, maxResults))
                .toList();
        auditService.record(SEARCH, query, true, snippets.size());
        return snippets;
    }

    @Override
    public Optional<ScrapeResult> scrape(String url) {
        if (!configured) {
            auditService.skipped(SCRAPE, "skills endpoint not configured");
            return Optional.empty();
        }
        ScrapeResponse response = skillsWebClient.post()
                .uri("/scrape/review")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("url", url, "include_summary", false))
                .retrieve()
                .bodyToMono(ScrapeResponse.class)
                .timeout(timeout)
                .onErrorResume(throwable -> {
                    log.warn("Web scrape failed: {}", throwable.getMessage());
                    auditService.record(SCRAPE, url, false, 0);
                    return Mono.empty();
                })
                .block();
        if (response == null) {
            return Optional.empty();
        }
        auditService.record(SCRAPE, url, true, response.text() == null || response.text().isBlank() ? 0 : 1);
        return Optional.of(new ScrapeResult(url, response.text(), response.summary()));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private record SearchResponse(List<Result> results, List<Result> items) {
        List<SearchSnippet> snippets() {
            List<Result> source = results != null ? results : items;
            if (source == null) {
                return Collections.emptyList();
            }
            return source.stream().map(Result::toSnippet).toList();
        }
    }

    private record Result(String title, String snippet, String description, String url, String link) {
        SearchSnippet toSnippet() {
            return new SearchSnippet(title, snippet != null ? snippet : description, url != null ? url : link);
        }
    }

    private record ScrapeResponse(String text, String summary) {}
}
