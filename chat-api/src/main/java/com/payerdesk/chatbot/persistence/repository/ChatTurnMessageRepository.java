package com.payerdesk.chatbot.persistence.repository;

import com.payerdesk.chatbot.persistence.entity.ChatTurnMessageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ChatTurnMessageRepository extends JpaRepository<ChatTurnMessageEntity, Long> {

    @Query("select coalesce(max(m.sequence), -1) from ChatTurnMessageEntity m where m.threadId = :threadId")
    int findMaxSequence(@Param("threadId") String threadId);

    List<ChatTurnMessageEntity> findByThreadIdOrderBySequenceAsc(String threadId);
}
