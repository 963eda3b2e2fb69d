package com.payerdesk.chatbot.service.skills;

import java.util.List;
import java.util.Optional;

/**
 * Web search and page scraping. Implementations never throw; failures come back as empty results.
 */
public interface ExternalSearchSkill {

    List<SearchSnippet> search(String query, int maxResults);

    Optional<ScrapeResult> scrape(String url);
}
