package com.payerdesk.chatbot.service.retrieval;

import java.util.List;

public interface SearchClient {

    /**
     * @param sourceTypes restricts hits to these source types; empty means unrestricted
     * @throws RetrievalException when the index cannot be queried
     */
    List<SearchCandidate> search(String query, SearchFilters filters, int k, List<String> sourceTypes);

    boolean isConfigured();
}
