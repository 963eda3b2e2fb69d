package com.payerdesk.chatbot.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

/**
 * One user question and the assistant's final answer on a thread.
 */
@Entity
@Table(name = "chat_turns")
public class ChatTurnEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "thread_id", nullable = false, length = 64)
    private String threadId;

    @Column(name = "correlation_id", nullable = false, length = 64)
    private String correlationId;

    @Column(name = "user_content", length = 8000)
    private String userContent;

    @Column(name = "assistant_content", length = 20000)
    private String assistantContent;

    /**
     * JSON array of the document ids cited in the answer.
     */
    @Column(name = "source_document_ids", length = 4000)
    private String sourceDocumentIds;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected ChatTurnEntity() {
    }

    public ChatTurnEntity(String threadId, String correlationId, String userContent, String assistantContent) {
        this(threadId, correlationId, userContent, assistantContent, null);
    }

    public ChatTurnEntity(String threadId, String correlationId, String userContent, String assistantContent,
                          String sourceDocumentIds) {
        this.threadId = threadId;
        this.correlationId = correlationId;
        this.userContent = userContent;
        this.assistantContent = assistantContent;
        this.sourceDocumentIds = sourceDocumentIds;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public Long getId() {
        return id;
    }

    public String getThreadId() {
        return threadId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getUserContent() {
        return userContent;
    }

    public String getAssistantContent() {
        return assistantContent;
    }

    public String getSourceDocumentIds() {
        return sourceDocumentIds;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
