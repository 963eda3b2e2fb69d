package com.payerdesk.chatbot.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "chat_turn_messages")
public class ChatTurnMessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "thread_id", nullable = false, length = 64)
    private String threadId;

    @Column(name = "correlation_id", nullable = false, length = 64)
    private String correlationId;

    @Column(name = "role", nullable = false, length = 16)
    private String role;

    @Column(name = "content", length = 20000)
    private String content;

    @Column(name = "sequence_number", nullable = false)
    private int sequence;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected ChatTurnMessageEntity() {
    }

    public ChatTurnMessageEntity(String threadId, String correlationId, String role, String content, int sequence) {
        this.threadId = threadId;
        this.correlationId = correlationId;
        this.role = role;
        this.content = content;
        this.sequence = sequence;
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

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public int getSequence() {
        return sequence;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
