package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.model.SourceReference;
import com.payerdesk.chatbot.service.orchestration.LlmClient;
import com.payerdesk.chatbot.service.orchestration.LlmException;
import com.payerdesk.chatbot.service.orchestration.LlmPrompt;
import com.payerdesk.chatbot.service.orchestration.LlmResult;
import com.payerdesk.chatbot.service.planner.AgentType;
import com.payerdesk.chatbot.service.retrieval.ExternalSearchFallback;
import com.payerdesk.chatbot.service.retrieval.RetrievalChunk;
import com.payerdesk.chatbot.service.retrieval.RetrievalSignal;
import com.payerdesk.chatbot.service.skills.CapabilityRegistry;
import com.payerdesk.chatbot.service.skills.ExternalSearchSkill;
import com.payerdesk.chatbot.service.skills.ScrapeResult;
import com.payerdesk.chatbot.service.skills.SearchSnippet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Capability answers, web search and page scraping. Skills run only on an explicit trigger phrase.
 */
@Component
public class ToolAgent implements AnsweringAgent {

    private static final Logger log = LoggerFactory.getLogger(ToolAgent.class);

    static final List<String> SEARCH_TRIGGERS = List.of(
            "search google for", "search for", "look up", "find information about", "google ");
    static final List<String> SCRAPE_TRIGGERS = List.of("scrape", "fetch the page", "read this url");

    static final String NO_TOOL_TEXT = "I can search the web, scrape pages, and look up provider info. "
            + "For a web search, try asking something like 'Search for [topic]' or 'Look up [query]'. "
            + "For policy questions about appeals, grievances, or prior auth, just ask and I'll look in our materials.";
    static final String SCRAPE_NEEDS_URL = "I can scrape web pages when you give me a URL. "
            + "Try: 'Scrape https://example.com' or paste the URL.";
    static final String SEARCH_FAILED = "I tried to search the web but ran into an issue. Please try again or rephrase.";

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"']+", Pattern.CASE_INSENSITIVE);
    private static final int PREVIEW_LIMIT = 2000;
    private static final int SOURCE_TEXT_LIMIT = 300;
    private static final int CONTEXT_TEXT_LIMIT = 500;

    private static final String SEARCH_SYSTEM_PROMPT =
            "Use the following web search results to answer the user's question. Cite sources by number [1], [2], etc.";

    private final CapabilityRegistry capabilityRegistry;
    private final ExternalSearchSkill searchSkill;
    private final LlmClient llmClient;
    private final int maxResults;

    public ToolAgent(CapabilityRegistry capabilityRegistry,
                     ExternalSearchSkill searchSkill,
                     LlmClient llmClient,
                     @Value("${chat.retrieval.external-max-results:5}") int maxResults) {
        this.capabilityRegistry = capabilityRegistry;
        this.searchSkill = searchSkill;
        this.llmClient = llmClient;
        this.maxResults = maxResults;
    }

    @Override
    public AgentType type() {
        return AgentType.TOOL;
    }

    @Override
    public AgentAnswer answer(AgentTask task) {
        String id = task.subQuestion().id();
        String question = task.questionText();
        String lower = question.toLowerCase(Locale.ROOT);

        Optional<String> capability = capabilityRegistry.answerFor(question);
        if (capability.isPresent()) {
            task.thinking().accept("I can answer that from what I know about my capabilities.");
            return AgentAnswer.withoutSources(id, capability.get(), null);
        }

        if (SCRAPE_TRIGGERS.stream().anyMatch(lower::contains)) {
            Matcher matcher = URL.matcher(question);
            if (!matcher.find()) {
                return AgentAnswer.withoutSources(id, SCRAPE_NEEDS_URL, null);
            }
            return scrape(id, matcher.group(), task);
        }

        Optional<String> trigger = SEARCH_TRIGGERS.stream().filter(lower::contains).findFirst();
        if (trigger.isPresent()) {
            return search(id, question, searchQuery(question, lower, trigger.get()), task);
        }

        task.thinking().accept("This would use a tool. Let me explain what I can do.");
        return AgentAnswer.withoutSources(id, NO_TOOL_TEXT, null);
    }

    static String searchQuery(String question, String lower, String trigger) {
        int index = lower.indexOf(trigger);
        String query = question.substring(index + trigger.length()).trim();
        return query.isEmpty() ? question : query;
    }

    private AgentAnswer scrape(String id, String url, AgentTask task) {
        task.thinking().accept("Scraping the page...");
        Optional<ScrapeResult> result = searchSkill.scrape(url);
        if (result.isEmpty()) {
            return AgentAnswer.withoutSources(id, "I tried to scrape that URL but ran into an issue. Please try again later.", null);
        }
        if (!result.get().hasText()) {
            return AgentAnswer.withoutSources(id, "I couldn't extract content from " + url
                    + ". The page may be empty or block automated access.", null);
        }
        String text = result.get().text();
        String preview = text.length() > PREVIEW_LIMIT ? text.substring(0, PREVIEW_LIMIT) + "..." : text;
        StringBuilder answer = new StringBuilder("Here's the content from ").append(url).append(":\n\n").append(preview);
        if (result.get().summary() != null && !result.get().summary().isBlank()) {
            answer.append("\n\nSummary: ").append(result.get().summary());
        }
        SourceReference source = new SourceReference(1, null, url, null, RetrievalChunk.SOURCE_TYPE_EXTERNAL, null,
                null, ExternalSearchFallback.EXTERNAL_GUIDANCE, truncate(preview, SOURCE_TEXT_LIMIT));
        return new AgentAnswer(id, answer.toString(), null, List.of(source), RetrievalSignal.NO_SOURCES);
    }

    private AgentAnswer search(String id, String question, String query, AgentTask task) {
        task.thinking().accept("Searching the web...");
        List<SearchSnippet> snippets = searchSkill.search(query, maxResults);
        if (snippets.isEmpty()) {
            return AgentAnswer.withoutSources(id, SEARCH_FAILED, null);
        }
        task.thinking().accept("Found " + snippets.size() + " results. Summarizing...");
        List<SourceReference> sources = new ArrayList<>();
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < snippets.size() && i < maxResults; i++) {
            RetrievalChunk chunk = ExternalSearchFallback.toChunk(snippets.get(i), i);
            sources.add(new SourceReference(i + 1, null, chunk.documentName(), null, chunk.sourceType(), null,
                    chunk.confidenceLabel().wireName(), chunk.llmGuidance(), truncate(chunk.text(), SOURCE_TEXT_LIMIT)));
            context.append('[').append(i + 1).append("] ").append(chunk.documentName()).append(": ")
                    .append(truncate(chunk.text(), CONTEXT_TEXT_LIMIT)).append("\n\n");
        }
        try {
            LlmResult result = llmClient.generate(LlmPrompt.of(SEARCH_SYSTEM_PROMPT,
                    "Results:\n" + context + "Question: " + question));
            if (result.text() == null || result.text().isBlank()) {
                log.warn("Tool agent got an empty summary of {} search result(s)", sources.size());
                return new AgentAnswer(id, listing(sources), result.usage(), sources, RetrievalSignal.GOOGLE_ONLY);
            }
            return new AgentAnswer(id, result.text().trim(), result.usage(), sources, RetrievalSignal.GOOGLE_ONLY);
        } catch (LlmException ex) {
            log.warn("Tool agent could not summarize search results: {}", ex.getMessage());
            return new AgentAnswer(id, listing(sources), null, sources, RetrievalSignal.GOOGLE_ONLY);
        }
    }

    static String listing(List<SourceReference> sources) {
        StringBuilder listing = new StringBuilder("Here's what I found on the web:");
        for (SourceReference source : sources) {
            listing.append("\n[").append(source.index()).append("] ").append(source.documentName());
        }
        return listing.toString();
    }

    private static String truncate(String value, int limit) {
        if (value == null) {
            return "";
        }
        return value.length() > limit ? value.substring(0, limit) : value;
    }
}
