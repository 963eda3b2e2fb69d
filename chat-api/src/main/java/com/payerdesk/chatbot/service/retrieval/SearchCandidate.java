package com.payerdesk.chatbot.service.retrieval;

/**
 * Ranked hit from the search index; metadata is fetched separately by id.
 */
public record SearchCandidate(String id, Double score) {
}
