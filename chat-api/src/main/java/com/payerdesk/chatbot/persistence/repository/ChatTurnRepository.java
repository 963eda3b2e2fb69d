package com.payerdesk.chatbot.persistence.repository;

import com.payerdesk.chatbot.persistence.entity.ChatTurnEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChatTurnRepository extends JpaRepository<ChatTurnEntity, Long> {

    List<ChatTurnEntity> findByThreadIdOrderByIdDesc(String threadId, Pageable pageable);
}
