package com.payerdesk.chatbot.persistence.repository;

import com.payerdesk.chatbot.persistence.entity.ThreadStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ThreadStateRepository extends JpaRepository<ThreadStateEntity, String> {
}
