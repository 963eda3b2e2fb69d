package com.payerdesk.chatbot.service.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.persistence.entity.ChatTurnEntity;
import com.payerdesk.chatbot.persistence.entity.ChatTurnMessageEntity;
import com.payerdesk.chatbot.persistence.entity.ProgressEventEntity;
import com.payerdesk.chatbot.persistence.entity.ThreadStateEntity;
import com.payerdesk.chatbot.persistence.repository.ChatTurnMessageRepository;
import com.payerdesk.chatbot.persistence.repository.ChatTurnRepository;
import com.payerdesk.chatbot.persistence.repository.ProgressEventRepository;
import com.payerdesk.chatbot.persistence.repository.ThreadStateRepository;
import com.payerdesk.chatbot.service.state.ThreadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@Profile("!inmemory")
public class JpaConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaConversationStore.class);
    private static final TypeReference<List<String>> DOCUMENT_IDS = new TypeReference<>() {
    };

    private final ThreadStateRepository threadStateRepository;
    private final ChatTurnRepository chatTurnRepository;
    private final ChatTurnMessageRepository messageRepository;
    private final ProgressEventRepository progressEventRepository;
    private final ObjectMapper objectMapper;

    public JpaConversationStore(ThreadStateRepository threadStateRepository,
                                ChatTurnRepository chatTurnRepository,
                                ChatTurnMessageRepository messageRepository,
                                ProgressEventRepository progressEventRepository,
                                ObjectMapper objectMapper) {
        this.threadStateRepository = threadStateRepository;
        this.chatTurnRepository = chatTurnRepository;
        this.messageRepository = messageRepository;
        this.progressEventRepository = progressEventRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public void saveTurn(TurnRecord turn) {
        try {
            chatTurnRepository.save(new ChatTurnEntity(turn.threadId(), turn.correlationId(),
                    turn.userContent(), turn.assistantContent(), toJson(turn.sourceDocumentIds())));
        } catch (DataAccessException | ConversationStoreException ex) {
            log.warn("Dropped turn {} for thread {}: {}", turn.correlationId(), turn.threadId(), ex.getMessage());
        }
    }

    @Override
    public void appendMessages(String threadId, String correlationId, List<ConversationMessage> messages) {
        try {
            int sequence = messageRepository.findMaxSequence(threadId);
            for (ConversationMessage message : messages) {
                sequence++;
                messageRepository.save(new ChatTurnMessageEntity(threadId, correlationId, message.role(),
                        message.content(), sequence));
            }
        } catch (DataAccessException ex) {
            log.warn("Dropped messages for thread {}: {}", threadId, ex.getMessage());
        }
    }

    @Override
    public void saveState(String threadId, ThreadState state) {
        try {
            String json = toJson(state);
            ThreadStateEntity entity = threadStateRepository.findById(threadId)
                    .orElseGet(() -> new ThreadStateEntity(threadId, json, state.refinedQuery()));
            entity.setStateJson(json);
            entity.setRefinedQuery(state.refinedQuery());
            threadStateRepository.save(entity);
            log.debug("Persisted state for thread {}", threadId);
        } catch (DataAccessException | ConversationStoreException ex) {
            log.warn("Dropped state for thread {}: {}", threadId, ex.getMessage());
        }
    }

    @Override
    public Optional<ThreadState> loadState(String threadId) {
        try {
            return threadStateRepository.findById(threadId).map(entity -> fromJson(entity.getStateJson()));
        } catch (DataAccessException | ConversationStoreException ex) {
            log.warn("Could not load state for thread {}, starting fresh: {}", threadId, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<TurnRecord> lastTurns(String threadId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return chatTurnRepository.findByThreadIdOrderByIdDesc(threadId, PageRequest.of(0, limit)).stream()
                    .map(entity -> new TurnRecord(entity.getThreadId(), entity.getCorrelationId(),
                            entity.getUserContent(), entity.getAssistantContent(),
                            documentIds(entity.getSourceDocumentIds())))
                    .toList();
        } catch (DataAccessException ex) {
            log.warn("Could not load turns for thread {}: {}", threadId, ex.getMessage());
            return List.of();
        }
    }

    @Override
    public void appendProgressEvent(String correlationId, ProgressEvent event) {
        try {
            progressEventRepository.save(new ProgressEventEntity(correlationId, event.event().wireName(),
                    toJson(event.data())));
        } catch (DataAccessException | ConversationStoreException ex) {
            log.warn("Dropped progress event for {}: {}", correlationId, ex.getMessage());
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConversationStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private List<String> documentIds(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, DOCUMENT_IDS);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable source document ids: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private ThreadState fromJson(String json) {
        try {
            return objectMapper.readValue(json, ThreadState.class);
        } catch (JsonProcessingException e) {
            throw new ConversationStoreException("Failed to read thread state", e);
        }
    }
}
