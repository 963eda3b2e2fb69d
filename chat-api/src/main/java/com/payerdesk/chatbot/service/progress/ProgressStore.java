package com.payerdesk.chatbot.service.progress;

import com.payerdesk.chatbot.model.ProgressSnapshot;

import java.util.Optional;

/**
 * In-flight progress per correlation id. Single writer (the pipeline), any number of readers.
 * Readers may see a stale snapshot.
 */
public interface ProgressStore {

    void start(String correlationId);

    void appendThinking(String correlationId, String line);

    void appendMessageChunk(String correlationId, String chunk);

    /**
     * Empties the streamed message and records a reset event, so a replacement message does not land
     * after a partial one.
     */
    void resetMessage(String correlationId);

    /**
     * Empty when no run is in flight for the id, either not started yet or already published.
     */
    Optional<ProgressSnapshot> snapshot(String correlationId);

    ProgressBatch eventsSince(String correlationId, long offset);

    void clear(String correlationId);
}
