package com.payerdesk.chatbot.service.retrieval;

import java.util.List;

public interface MetadataStore {

    List<MetadataRecord> fetchByIds(List<String> ids);

    /**
     * Paragraphs of the same document within {@code window} positions of {@code paragraphIndex}, excluding {@code excludeId}.
     */
    List<MetadataRecord> fetchSiblings(String documentId, int paragraphIndex, int window, String excludeId);
}
