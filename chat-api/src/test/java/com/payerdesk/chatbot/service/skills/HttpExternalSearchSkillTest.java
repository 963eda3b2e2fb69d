package com.payerdesk.chatbot.service.skills;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HttpExternalSearchSkillTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final SkillAuditService auditService = new SkillAuditService(meterRegistry);

    @Test
    void readsEitherResultShapeAndSkipsEmptyHits() {
        HttpExternalSearchSkill skill = skill(HttpStatus.OK, """
                {"items": [
                  {"title": "Appeals guide", "description": "File within 60 days.", "link": "https://example.org/a"},
                  {"title": "", "snippet": ""},
                  {"title": "Second", "snippet": "More", "url": "https://example.org/b"}
                ]}""");

        List<SearchSnippet> snippets = skill.search("appeal deadline", 5);

        assertThat(snippets).containsExactly(
                new SearchSnippet("Appeals guide", "File within 60 days.", "https://example.org/a"),
                new SearchSnippet("Second", "More", "https://example.org/b"));
        assertThat(outcomeCount(HttpExternalSearchSkill.SEARCH, "success")).isEqualTo(1.0);
    }

    @Test
    void failuresComeBackEmptyAndAreAudited() {
        HttpExternalSearchSkill skill = skill(HttpStatus.BAD_GATEWAY, "{}");

        assertThat(skill.search("appeal", 5)).isEmpty();
        assertThat(skill.scrape("https://example.org")).isEmpty();
        assertThat(outcomeCount(HttpExternalSearchSkill.SEARCH, "failure")).isEqualTo(1.0);
        assertThat(outcomeCount(HttpExternalSearchSkill.SCRAPE, "failure")).isEqualTo(1.0);
    }

    @Test
    void scrapeReturnsPageText() {
        HttpExternalSearchSkill skill = skill(HttpStatus.OK, "{\"text\": \"Page body\", \"summary\": \"Short\"}");

        assertThat(skill.scrape("https://example.org/page"))
                .contains(new ScrapeResult("https://example.org/page", "Page body", "Short"));
    }

    @Test
    void unconfiguredSkillIsSkipped() {
        HttpExternalSearchSkill skill = new HttpExternalSearchSkill(webClient(HttpStatus.OK, "{}"), auditService, "", 5);

        assertThat(skill.search("appeal", 5)).isEmpty();
        assertThat(outcomeCount(HttpExternalSearchSkill.SEARCH, "skipped")).isEqualTo(1.0);
    }

    private HttpExternalSearchSkill skill(HttpStatus status, String body) {
        return new HttpExternalSearchSkill(webClient(status, body), auditService, "http://skills.local", 5);
    }

    private double outcomeCount(String skill, String outcome) {
        return meterRegistry.counter("chat.skill.invocations", "skill", skill, "outcome", outcome).count();
    }

    private static WebClient webClient(HttpStatus status, String body) {
        return WebClient.builder()
                .baseUrl("http://skills.local")
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
    }
}
