package com.payerdesk.chatbot.service.memory;

import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.service.state.ThreadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Profile("inmemory")
public class InMemoryConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);

    private final Map<String, ThreadState> states = new ConcurrentHashMap<>();
    private final Map<String, List<TurnRecord>> turns = new ConcurrentHashMap<>();
    private final Map<String, List<ConversationMessage>> messages = new ConcurrentHashMap<>();
    private final Map<String, List<ProgressEvent>> progressEvents = new ConcurrentHashMap<>();

    @Override
    public void saveTurn(TurnRecord turn) {
        turns.compute(turn.threadId(), (key, existing) -> {
            List<TurnRecord> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            updated.add(turn);
            return updated;
        });
    }

    @Override
    public void appendMessages(String threadId, String correlationId, List<ConversationMessage> newMessages) {
        messages.compute(threadId, (key, existing) -> {
            List<ConversationMessage> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            updated.addAll(newMessages);
            return updated;
        });
        log.debug("Stored {} messages for thread {} ({})", newMessages.size(), threadId, correlationId);
    }

    @Override
    public void saveState(String threadId, ThreadState state) {
        states.put(threadId, state);
    }

    @Override
    public Optional<ThreadState> loadState(String threadId) {
        return Optional.ofNullable(states.get(threadId));
    }

    @Override
    public List<TurnRecord> lastTurns(String threadId, int limit) {
        List<TurnRecord> all = turns.getOrDefault(threadId, List.of());
        List<TurnRecord> newestFirst = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0 && newestFirst.size() < limit; i--) {
            newestFirst.add(all.get(i));
        }
        return List.copyOf(newestFirst);
    }

    @Override
    public void appendProgressEvent(String correlationId, ProgressEvent event) {
        progressEvents.compute(correlationId, (key, existing) -> {
            List<ProgressEvent> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            updated.add(event);
            return updated;
        });
    }

    List<ConversationMessage> messages(String threadId) {
        return List.copyOf(messages.getOrDefault(threadId, List.of()));
    }

    List<ProgressEvent> progressEvents(String correlationId) {
        return List.copyOf(progressEvents.getOrDefault(correlationId, List.of()));
    }
}
