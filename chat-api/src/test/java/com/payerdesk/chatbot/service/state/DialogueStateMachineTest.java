package com.payerdesk.chatbot.service.state;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DialogueStateMachineTest {

    private final DialogueStateMachine stateMachine = new DialogueStateMachine(new PayerDirectory(new PayerProperties()));

    @Test
    void payerAnswerToOpenSlotIsSlotFill() {
        MessageClassification classification = stateMachine.classify(
                "Sunshine Health", List.of(ClarificationPolicy.SLOT_PAYOR), "How do I file an appeal?");

        assertThat(classification).isEqualTo(MessageClassification.SLOT_FILL);
    }

    @Test
    void fullQuestionIsNewQuestionEvenWithOpenSlots() {
        MessageClassification classification = stateMachine.classify(
                "What is the timely filing limit for claims?", List.of(ClarificationPolicy.SLOT_PAYOR), "How do I file an appeal?");

        assertThat(classification).isEqualTo(MessageClassification.NEW_QUESTION);
    }

    @Test
    void shortFollowUpWithoutQuestionMarkExtendsPreviousQuery() {
        assertThat(stateMachine.classify("Florida", List.of(), "How do I file an appeal?"))
                .isEqualTo(MessageClassification.SLOT_FILL);
        assertThat(stateMachine.classify("Florida?", List.of(), "How do I file an appeal?"))
                .isEqualTo(MessageClassification.NEW_QUESTION);
        assertThat(stateMachine.classify("Florida", List.of(), null))
                .isEqualTo(MessageClassification.NEW_QUESTION);
    }

    @Test
    void blankMessageIsNewQuestion() {
        assertThat(stateMachine.classify("   ", List.of(ClarificationPolicy.SLOT_PAYOR), "previous"))
                .isEqualTo(MessageClassification.NEW_QUESTION);
    }

    @Test
    void slotFillAppendsJurisdictionToPreviousRefinedQuery() {
        Jurisdiction jurisdiction = new Jurisdiction(null, "Sunshine Health", null, null, null);

        String refined = stateMachine.computeRefinedQuery(MessageClassification.SLOT_FILL, "Sunshine Health",
                "How do I file an appeal?", "Sunshine Health", jurisdiction);

        assertThat(refined).isEqualTo("How do I file an appeal? for Sunshine Health");
    }

    @Test
    void newQuestionStartsFromPlannedText() {
        Jurisdiction jurisdiction = new Jurisdiction("Florida", "Aetna", "Medicaid", null, null);

        String refined = stateMachine.computeRefinedQuery(MessageClassification.NEW_QUESTION, "raw text",
                "older question", "What is the appeal deadline?", jurisdiction);

        assertThat(refined).isEqualTo("What is the appeal deadline? for Aetna in Florida (Medicaid)");
    }

    @Test
    void refinedQueryIsNotExtendedTwiceWithSameJurisdiction() {
        Jurisdiction jurisdiction = new Jurisdiction(null, "Aetna", null, null, null);

        assertThat(stateMachine.buildRefinedQuery("Appeals for Aetna", jurisdiction)).isEqualTo("Appeals for Aetna");
        assertThat(stateMachine.buildRefinedQuery("Appeals", Jurisdiction.empty())).isEqualTo("Appeals");
    }

    @Test
    void applyDeltaMergesActiveAndReplacesLists() {
        ThreadState start = stateMachine.applyDelta(ThreadState.empty(), StateDelta.builder()
                .active(ActiveField.PAYER, "Aetna")
                .active(ActiveField.DOMAIN, "claims")
                .openSlots(List.of(ClarificationPolicy.SLOT_PAYOR))
                .refinedQuery("How do I file a claim?")
                .build());

        ThreadState next = stateMachine.applyDelta(start, StateDelta.builder()
                .active(ActiveField.JURISDICTION, "Florida")
                .clear(ActiveField.DOMAIN)
                .openSlots(List.of())
                .build());

        assertThat(next.active().payer()).isEqualTo("Aetna");
        assertThat(next.active().jurisdiction()).isEqualTo("Florida");
        assertThat(next.active().domain()).isNull();
        assertThat(next.openSlots()).isEmpty();
        assertThat(next.refinedQuery()).isEqualTo("How do I file a claim?");
    }

    @Test
    void applyDeltaDropsPatientIdentifyingValues() {
        ThreadState state = stateMachine.applyDelta(ThreadState.empty(), StateDelta.builder()
                .active(ActiveField.PAYER, "DOB 01/02/1980")
                .activeEntry("member_id", "ABC123")
                .recentEntities(List.of("Aetna", "MRN 12345678"))
                .build());

        assertThat(state.active().payer()).isNull();
        assertThat(state.recentEntities()).containsExactly("Aetna");
    }

    @Test
    void wordCountIgnoresSurroundingWhitespace() {
        assertThat(DialogueStateMachine.wordCount("  one two   three ")).isEqualTo(3);
        assertThat(DialogueStateMachine.wordCount(null)).isZero();
    }
}
