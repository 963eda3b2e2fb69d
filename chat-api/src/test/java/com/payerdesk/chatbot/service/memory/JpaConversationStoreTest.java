package com.payerdesk.chatbot.service.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.persistence.entity.ChatTurnMessageEntity;
import com.payerdesk.chatbot.persistence.repository.ChatTurnMessageRepository;
import com.payerdesk.chatbot.persistence.repository.ChatTurnRepository;
import com.payerdesk.chatbot.persistence.repository.ProgressEventRepository;
import com.payerdesk.chatbot.persistence.repository.ThreadStateRepository;
import com.payerdesk.chatbot.service.state.ActiveContext;
import com.payerdesk.chatbot.service.state.Jurisdiction;
import com.payerdesk.chatbot.service.state.MessageClassification;
import com.payerdesk.chatbot.service.state.ThreadState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DataJpaTest
@ActiveProfiles("test")
class JpaConversationStoreTest {

    @Autowired
    private ThreadStateRepository threadStateRepository;

    @Autowired
    private ChatTurnRepository chatTurnRepository;

    @Autowired
    private ChatTurnMessageRepository messageRepository;

    @Autowired
    private ProgressEventRepository progressEventRepository;

    private JpaConversationStore store;

    @BeforeEach
    void setUp() {
        store = new JpaConversationStore(threadStateRepository, chatTurnRepository, messageRepository,
                progressEventRepository, new ObjectMapper());
    }

    @Test
    void stateSurvivesARoundTripAndIsOverwritten() {
        ActiveContext active = new ActiveContext("Sunshine Health", List.of("Sunshine Health"), "appeals", "Florida",
                "Medicaid", "provider_office", new Jurisdiction("Florida", "Sunshine Health", "Medicaid", null, null));
        ThreadState state = new ThreadState(active, List.of(), List.of("Sunshine Health"),
                MessageClassification.SLOT_FILL, "How do I file an appeal? for Sunshine Health",
                new ThreadState.Safety(false));

        store.saveState("t1", ThreadState.empty());
        store.saveState("t1", state);

        assertThat(store.loadState("t1")).contains(state);
        assertThat(threadStateRepository.findById("t1")).hasValueSatisfying(entity ->
                assertThat(entity.getRefinedQuery()).isEqualTo("How do I file an appeal? for Sunshine Health"));
        assertThat(store.loadState("t2")).isEmpty();
    }

    @Test
    void lastTurnsAreNewestFirstAndLimited() {
        store.saveTurn(new TurnRecord("t1", "c1", "first question", "first answer"));
        store.saveTurn(new TurnRecord("t1", "c2", "second question", "second answer"));
        store.saveTurn(new TurnRecord("t1", "c3", "third question", "third answer"));
        store.saveTurn(new TurnRecord("t2", "c4", "other thread", "other answer"));

        assertThat(store.lastTurns("t1", 2)).extracting(TurnRecord::correlationId).containsExactly("c3", "c2");
        assertThat(store.lastTurns("t1", 0)).isEmpty();
    }

    @Test
    void citedDocumentIdsComeBackWithTheTurn() {
        store.saveTurn(new TurnRecord("t5", "c1", "appeal deadline?", "60 days [1]", List.of("manual-1", "bulletin-7")));
        store.saveTurn(new TurnRecord("t5", "c2", "thanks", "You're welcome."));

        assertThat(store.lastTurns("t5", 5))
                .extracting(TurnRecord::correlationId, TurnRecord::sourceDocumentIds)
                .containsExactly(tuple("c2", List.of()), tuple("c1", List.of("manual-1", "bulletin-7")));
    }

    @Test
    void messagesContinueTheThreadSequence() {
        store.appendMessages("t1", "c1", List.of(ConversationMessage.user("q1"), ConversationMessage.assistant("a1")));
        store.appendMessages("t1", "c2", List.of(ConversationMessage.user("q2")));

        assertThat(messageRepository.findByThreadIdOrderBySequenceAsc("t1"))
                .extracting(ChatTurnMessageEntity::getSequence, ChatTurnMessageEntity::getRole)
                .containsExactly(
                        tuple(0, "user"),
                        tuple(1, "assistant"),
                        tuple(2, "user"));
    }

    @Test
    void progressEventsAreStoredAsJson() {
        store.appendProgressEvent("c1", ProgressEvent.message("Use form A."));

        assertThat(progressEventRepository.findByCorrelationIdOrderByIdAsc("c1"))
                .singleElement()
                .satisfies(entity -> {
                    assertThat(entity.getEventType()).isEqualTo("message");
                    assertThat(entity.getDataJson()).isEqualTo("{\"chunk\":\"Use form A.\"}");
                });
    }
}
