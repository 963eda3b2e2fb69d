package com.payerdesk.chatbot.persistence.repository;

import com.payerdesk.chatbot.persistence.entity.ProgressEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProgressEventRepository extends JpaRepository<ProgressEventEntity, Long> {

    List<ProgressEventEntity> findByCorrelationIdOrderByIdAsc(String correlationId);
}
