package com.payerdesk.chatbot.service.progress;

import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.model.ProgressSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryProgressStoreTest {

    private final InMemoryProgressStore store = new InMemoryProgressStore(3);

    @Test
    void snapshotIsEmptyBeforeStartAndAfterClear() {
        assertThat(store.snapshot("c1")).isEmpty();

        store.start("c1");
        assertThat(store.snapshot("c1")).contains(new ProgressSnapshot(List.of(), ""));

        store.clear("c1");
        assertThat(store.snapshot("c1")).isEmpty();
    }

    @Test
    void writesBeforeStartAreIgnored() {
        store.appendThinking("c1", "Planning...");

        store.start("c1");

        assertThat(store.snapshot("c1")).hasValueSatisfying(snapshot -> assertThat(snapshot.thinkingLines()).isEmpty());
    }

    @Test
    void resetDropsThePartialMessageAndTellsStreamReaders() {
        store.start("c1");
        store.appendMessageChunk("c1", "Half an ans");

        store.resetMessage("c1");
        store.appendMessageChunk("c1", "Whole answer.");

        assertThat(store.snapshot("c1")).hasValueSatisfying(snapshot -> assertThat(snapshot.partialMessage()).isEqualTo("Whole answer."));
        assertThat(store.eventsSince("c1", 0).events()).extracting(ProgressEvent::event)
                .containsExactly(ProgressEvent.Type.MESSAGE, ProgressEvent.Type.MESSAGE_RESET, ProgressEvent.Type.MESSAGE);
    }

    @Test
    void eventsAreReadFromAnOffset() {
        store.start("c1");
        store.appendThinking("c1", "  Planning...  ");
        store.appendMessageChunk("c1", "Hello ");
        store.appendThinking("c1", " ");

        ProgressBatch first = store.eventsSince("c1", 0);
        assertThat(first.events()).extracting(ProgressEvent::event)
                .containsExactly(ProgressEvent.Type.THINKING, ProgressEvent.Type.MESSAGE);
        assertThat(first.events().get(0).data()).containsEntry("line", "Planning...");
        assertThat(first.nextOffset()).isEqualTo(2);

        store.appendMessageChunk("c1", "world");
        ProgressBatch second = store.eventsSince("c1", first.nextOffset());
        assertThat(second.events()).extracting(event -> event.data().get("chunk")).containsExactly("world");
        assertThat(second.nextOffset()).isEqualTo(3);
    }

    @Test
    void overflowStillUpdatesTheSnapshot() {
        store.start("c1");
        for (int i = 0; i < 5; i++) {
            store.appendMessageChunk("c1", String.valueOf(i));
        }

        assertThat(store.eventsSince("c1", 0).events()).hasSize(3);
        assertThat(store.snapshot("c1")).hasValueSatisfying(snapshot ->
                assertThat(snapshot.partialMessage()).isEqualTo("01234"));
    }

    @Test
    void unknownIdKeepsTheOffset() {
        ProgressBatch batch = store.eventsSince("missing", 7);

        assertThat(batch.events()).isEmpty();
        assertThat(batch.nextOffset()).isEqualTo(7);
    }
}
