package com.payerdesk.chatbot.service.progress;

import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local progress. Each record keeps at most {@code capacity} events; later events still update the snapshot.
 */
public class InMemoryProgressStore implements ProgressStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProgressStore.class);

    private final Map<String, Progress> progress = new ConcurrentHashMap<>();
    private final int capacity;

    public InMemoryProgressStore(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public void start(String correlationId) {
        progress.put(correlationId, new Progress());
    }

    @Override
    public void appendThinking(String correlationId, String line) {
        Progress record = progress.get(correlationId);
        if (record == null || line == null || line.isBlank()) {
            return;
        }
        synchronized (record) {
            record.thinking.add(line.trim());
            record.offer(ProgressEvent.thinking(line.trim()), capacity, correlationId);
        }
    }

    @Override
    public void appendMessageChunk(String correlationId, String chunk) {
        Progress record = progress.get(correlationId);
        if (record == null || chunk == null || chunk.isEmpty()) {
            return;
        }
        synchronized (record) {
            record.message.append(chunk);
            record.offer(ProgressEvent.message(chunk), capacity, correlationId);
        }
    }

    @Override
    public void resetMessage(String correlationId) {
        Progress record = progress.get(correlationId);
        if (record == null) {
            return;
        }
        synchronized (record) {
            record.message.setLength(0);
            record.offer(ProgressEvent.messageReset(), capacity, correlationId);
        }
    }

    @Override
    public Optional<ProgressSnapshot> snapshot(String correlationId) {
        Progress record = progress.get(correlationId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            return Optional.of(new ProgressSnapshot(record.thinking, record.message.toString()));
        }
    }

    @Override
    public ProgressBatch eventsSince(String correlationId, long offset) {
        Progress record = progress.get(correlationId);
        if (record == null) {
            return ProgressBatch.empty(offset);
        }
        synchronized (record) {
            int from = (int) Math.max(0, Math.min(offset, record.events.size()));
            return new ProgressBatch(record.events.subList(from, record.events.size()), record.events.size());
        }
    }

    @Override
    public void clear(String correlationId) {
        progress.remove(correlationId);
    }

    private static final class Progress {
        private final List<String> thinking = new ArrayList<>();
        private final StringBuilder message = new StringBuilder();
        private final List<ProgressEvent> events = new ArrayList<>();
        private boolean overflowLogged;

        void offer(ProgressEvent event, int capacity, String correlationId) {
            if (events.size() < capacity) {
                events.add(event);
            } else if (!overflowLogged) {
                overflowLogged = true;
                log.warn("Progress event buffer full for {}; further events only update the snapshot", correlationId);
            }
        }
    }
}
