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
@Table(name = "progress_events")
public class ProgressEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "correlation_id", nullable = false, length = 64)
    private String correlationId;

    @Column(name = "event_type", nullable = false, length = 32)
    private String eventType;

    @Column(name = "data_json", length = 8000)
    private String dataJson;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected ProgressEventEntity() {
    }

    public ProgressEventEntity(String correlationId, String eventType, String dataJson) {
        this.correlationId = correlationId;
        this.eventType = eventType;
        this.dataJson = dataJson;
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

    public String getCorrelationId() {
        return correlationId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getDataJson() {
        return dataJson;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
