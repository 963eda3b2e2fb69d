package com.payerdesk.chatbot.service.state;

import com.payerdesk.chatbot.service.memory.TurnRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextRouterTest {

    private final ContextRouter router = new ContextRouter();
    private final DialogueStateMachine stateMachine = new DialogueStateMachine(new PayerDirectory(new PayerProperties()));

    @Test
    void payerChangeStartsStandalone() {
        assertThat(router.route("What about Cigna?", withPayer("Aetna"), StateExtractor.PAYER_CHANGE))
                .isEqualTo(ContextRoute.STANDALONE);
        assertThat(router.route("New question: how do refunds work", withPayer("Aetna"), null))
                .isEqualTo(ContextRoute.STANDALONE);
    }

    @Test
    void pronounsAndActivePayerKeepState() {
        assertThat(router.route("Can you expand on that", ThreadState.empty(), null)).isEqualTo(ContextRoute.STATEFUL);
        assertThat(router.route("How do I file an appeal?", withPayer("Aetna"), null)).isEqualTo(ContextRoute.STATEFUL);
    }

    @Test
    void freshThreadIsLight() {
        assertThat(router.route("How do I file an appeal?", ThreadState.empty(), null)).isEqualTo(ContextRoute.LIGHT);
    }

    @Test
    void standalonePackIsEmpty() {
        assertThat(router.buildPack(ContextRoute.STANDALONE, withPayer("Aetna"), List.of(turn("q", "a")))).isEmpty();
    }

    @Test
    void lightPackCarriesOnlyNewestTurnTruncated() {
        String longAnswer = "x".repeat(250);

        String pack = router.buildPack(ContextRoute.LIGHT, ThreadState.empty(),
                List.of(turn("newest question", longAnswer), turn("older question", "older answer")));

        assertThat(pack).startsWith("Context: payer=-; domain=-; jurisdiction=-; role=-. Open questions: none.");
        assertThat(pack).contains("Last turn:\nUser: newest question\nAssistant: " + "x".repeat(200) + "...");
        assertThat(pack).doesNotContain("older question");
    }

    @Test
    void statefulPackCarriesTwoTurns() {
        String pack = router.buildPack(ContextRoute.STATEFUL, withPayer("Aetna"),
                List.of(turn("second", "answer two"), turn("first", "answer one"), turn("zeroth", "answer zero")));

        assertThat(pack).contains("payer=Aetna");
        assertThat(pack).contains("Turn 1:\nUser: second").contains("Turn 2:\nUser: first");
        assertThat(pack).doesNotContain("zeroth");
        assertThat(pack).endsWith("\n\n");
    }

    private ThreadState withPayer(String payer) {
        return stateMachine.applyDelta(ThreadState.empty(), StateDelta.builder().active(ActiveField.PAYER, payer).build());
    }

    private static TurnRecord turn(String user, String assistant) {
        return new TurnRecord("thread-1", "corr", user, assistant);
    }
}
