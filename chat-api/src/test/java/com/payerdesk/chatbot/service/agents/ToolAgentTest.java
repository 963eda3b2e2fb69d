package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.service.orchestration.LlmClient;
import com.payerdesk.chatbot.service.orchestration.LlmException;
import com.payerdesk.chatbot.service.orchestration.LlmResult;
import com.payerdesk.chatbot.service.orchestration.LlmUsage;
import com.payerdesk.chatbot.service.retrieval.RetrievalChunk;
import com.payerdesk.chatbot.service.retrieval.RetrievalSignal;
import com.payerdesk.chatbot.service.skills.CapabilityRegistry;
import com.payerdesk.chatbot.service.skills.ExternalSearchSkill;
import com.payerdesk.chatbot.service.skills.ScrapeResult;
import com.payerdesk.chatbot.service.skills.SearchSnippet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ToolAgentTest {

    private final ExternalSearchSkill searchSkill = mock(ExternalSearchSkill.class);
    private final LlmClient llmClient = mock(LlmClient.class);
    private final ToolAgent agent = new ToolAgent(new CapabilityRegistry(), searchSkill, llmClient, 5);

    @Test
    void capabilityQuestionsUseCannedAnswers() {
        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "What can you do?", new ArrayList<>()));

        assertThat(answer.text()).startsWith("I can help with:");
        verifyNoInteractions(searchSkill, llmClient);
    }

    @Test
    void searchTriggerRunsWebSearchAndSummarizes() {
        when(searchSkill.search("appeal forms for Aetna", 5)).thenReturn(List.of(
                new SearchSnippet("Aetna appeals", "Use the online form", "https://aetna.example/appeals"),
                new SearchSnippet(null, "Mail the form", "https://other.example")));
        LlmUsage usage = new LlmUsage("openai", "gpt-4o-mini", 200, 50);
        when(llmClient.generate(any())).thenReturn(new LlmResult("Use the online form [1].", usage));

        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "Search for appeal forms for Aetna", new ArrayList<>()));

        assertThat(answer.text()).isEqualTo("Use the online form [1].");
        assertThat(answer.signal()).isEqualTo(RetrievalSignal.GOOGLE_ONLY);
        assertThat(answer.usage()).isEqualTo(usage);
        assertThat(answer.sources()).hasSize(2);
        assertThat(answer.sources().get(0).documentName()).isEqualTo("Aetna appeals");
        assertThat(answer.sources().get(0).sourceType()).isEqualTo(RetrievalChunk.SOURCE_TYPE_EXTERNAL);
        assertThat(answer.sources().get(1).documentName()).isEqualTo("https://other.example");
    }

    @Test
    void searchListingSurvivesLlmFailure() {
        when(searchSkill.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchSnippet("Result", "body", "https://r.example")));
        when(llmClient.generate(any())).thenThrow(new LlmException("timeout"));

        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "look up timely filing", new ArrayList<>()));

        assertThat(answer.text()).isEqualTo("Here's what I found on the web:\n[1] Result");
        assertThat(answer.usage()).isNull();
    }

    @Test
    void missingSummaryTextFallsBackToListing() {
        when(searchSkill.search(anyString(), anyInt())).thenReturn(List.of(
                new SearchSnippet("Result", "body", "https://r.example")));
        LlmUsage usage = new LlmUsage("openai", "gpt-4o-mini", 90, 0);
        when(llmClient.generate(any())).thenReturn(new LlmResult(null, usage));

        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "look up timely filing", new ArrayList<>()));

        assertThat(answer.text()).isEqualTo("Here's what I found on the web:\n[1] Result");
        assertThat(answer.usage()).isEqualTo(usage);
        assertThat(answer.signal()).isEqualTo(RetrievalSignal.GOOGLE_ONLY);
    }

    @Test
    void emptySearchReportsFailure() {
        when(searchSkill.search(anyString(), anyInt())).thenReturn(List.of());

        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "search for nothing", new ArrayList<>()));

        assertThat(answer.text()).isEqualTo(ToolAgent.SEARCH_FAILED);
        assertThat(answer.signal()).isEqualTo(RetrievalSignal.NO_SOURCES);
    }

    @Test
    void scrapeNeedsUrl() {
        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "scrape the appeals page", new ArrayList<>()));

        assertThat(answer.text()).isEqualTo(ToolAgent.SCRAPE_NEEDS_URL);
        verifyNoInteractions(searchSkill);
    }

    @Test
    void scrapeReturnsPagePreview() {
        when(searchSkill.scrape("https://plan.example/appeals"))
                .thenReturn(Optional.of(new ScrapeResult("https://plan.example/appeals", "Appeals must be filed in 60 days.", "60 day limit")));

        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "Scrape https://plan.example/appeals please", new ArrayList<>()));

        assertThat(answer.text()).isEqualTo("Here's the content from https://plan.example/appeals:\n\n"
                + "Appeals must be filed in 60 days.\n\nSummary: 60 day limit");
        assertThat(answer.sources()).singleElement()
                .satisfies(source -> assertThat(source.documentName()).isEqualTo("https://plan.example/appeals"));
    }

    @Test
    void noTriggerExplainsTools() {
        AgentAnswer answer = agent.answer(AgentRouterTest.task("sq1", "use a tool", new ArrayList<>()));

        assertThat(answer.text()).isEqualTo(ToolAgent.NO_TOOL_TEXT);
    }

    @Test
    void searchQueryFollowsTrigger() {
        String question = "Please look up Aetna timely filing";

        assertThat(ToolAgent.searchQuery(question, question.toLowerCase(), "look up")).isEqualTo("Aetna timely filing");
        assertThat(ToolAgent.searchQuery("search for", "search for", "search for")).isEqualTo("search for");
    }
}
