package com.payerdesk.chatbot.service.memory;

import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.service.state.ThreadState;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for threads. Writes never throw: a failed write is logged and dropped.
 */
public interface ConversationStore {

    void saveTurn(TurnRecord turn);

    void appendMessages(String threadId, String correlationId, List<ConversationMessage> messages);

    void saveState(String threadId, ThreadState state);

    Optional<ThreadState> loadState(String threadId);

    /**
     * The most recent turns on the thread, newest first.
     */
    List<TurnRecord> lastTurns(String threadId, int limit);

    void appendProgressEvent(String correlationId, ProgressEvent event);
}
