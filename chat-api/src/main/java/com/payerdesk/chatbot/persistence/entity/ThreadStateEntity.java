package com.payerdesk.chatbot.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "thread_states")
public class ThreadStateEntity {

    @Id
    @Column(name = "thread_id", nullable = false, length = 64)
    private String threadId;

    @Column(name = "state_json", nullable = false, length = 20000)
    private String stateJson;

    @Column(name = "refined_query", length = 4000)
    private String refinedQuery;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected ThreadStateEntity() {
    }

    public ThreadStateEntity(String threadId, String stateJson, String refinedQuery) {
        this.threadId = threadId;
        this.stateJson = stateJson;
        this.refinedQuery = refinedQuery;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = OffsetDateTime.now();
    }

    public String getThreadId() {
        return threadId;
    }

    public String getStateJson() {
        return stateJson;
    }

    public void setStateJson(String stateJson) {
        this.stateJson = stateJson;
    }

    public String getRefinedQuery() {
        return refinedQuery;
    }

    public void setRefinedQuery(String refinedQuery) {
        this.refinedQuery = refinedQuery;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
