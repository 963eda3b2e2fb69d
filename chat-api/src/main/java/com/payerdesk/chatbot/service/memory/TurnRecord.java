package com.payerdesk.chatbot.service.memory;

import java.util.List;

/**
 * One completed exchange on a thread, as handed back to the context router.
 * {@code sourceDocumentIds} lists the corpus documents the answer cited, in source order.
 */
public record TurnRecord(String threadId,
                         String correlationId,
                         String userContent,
                         String assistantContent,
                         List<String> sourceDocumentIds) {

    public TurnRecord {
        sourceDocumentIds = sourceDocumentIds == null ? List.of() : List.copyOf(sourceDocumentIds);
    }

    public TurnRecord(String threadId, String correlationId, String userContent, String assistantContent) {
        this(threadId, correlationId, userContent, assistantContent, List.of());
    }
}
