package com.payerdesk.chatbot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.ChatAccepted;
import com.payerdesk.chatbot.model.ChatRequest;
import com.payerdesk.chatbot.model.PollResponse;
import com.payerdesk.chatbot.model.PollResult;
import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import com.payerdesk.chatbot.model.ResponseStatus;
import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.planner.InMemoryPlanStore;
import com.payerdesk.chatbot.service.planner.PlanStore;
import com.payerdesk.chatbot.service.progress.InMemoryProgressStore;
import com.payerdesk.chatbot.service.queue.InMemoryChatQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultChatServiceTest {

    private final InMemoryChatQueue chatQueue = new InMemoryChatQueue();
    private final InMemoryProgressStore progressStore = new InMemoryProgressStore(100);
    private final PlanStore planStore = new InMemoryPlanStore(10);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private DefaultChatService service(Duration keepalive, Duration maxDuration) {
        return new DefaultChatService(chatQueue, progressStore, planStore, new ObjectMapper(), meterRegistry,
                Duration.ofMillis(10), keepalive, maxDuration);
    }

    private final DefaultChatService service = service(Duration.ofSeconds(15), Duration.ofSeconds(5));

    @Test
    void submitEnqueuesTrimmedMessageAndKeepsTheThread() throws InterruptedException {
        ChatAccepted accepted = service.submit(new ChatRequest("  How do I appeal?  ", " t1 ", "s1"), "user-1");

        assertThat(accepted.threadId()).isEqualTo("t1");
        QueuedRequest queued = chatQueue.pollRequest(Duration.ofMillis(10)).orElseThrow();
        assertThat(queued.correlationId()).isEqualTo(accepted.correlationId());
        assertThat(queued.message()).isEqualTo("How do I appeal?");
        assertThat(queued.sessionId()).isEqualTo("s1");
        assertThat(queued.userId()).isEqualTo("user-1");
        assertThat(meterRegistry.counter("chat.queue.published").count()).isEqualTo(1.0);
    }

    @Test
    void submitWithoutThreadStartsANewOne() {
        ChatAccepted accepted = service.submit(new ChatRequest("Hi", null, null), "anonymous");

        assertThat(accepted.threadId()).isNotBlank().isNotEqualTo(accepted.correlationId());
    }

    @Test
    void pollReportsPendingThenProcessingThenTheStoredPayload() {
        assertThat(service.poll("c1")).isEqualTo(PollResponse.pending());

        progressStore.start("c1");
        progressStore.appendThinking("c1", "Planning...");
        PollResult processing = service.poll("c1");
        assertThat(processing.status()).isEqualTo(ResponseStatus.PROCESSING);
        assertThat(((PollResponse) processing).thinkingLog()).containsExactly("Planning...");

        ResponsePayload failed = ResponsePayload.failed("c1", "t1", "Something went wrong.");
        chatQueue.publishResponse(failed);
        assertThat(service.poll("c1")).isEqualTo(failed);
    }

    @Test
    void streamForwardsProgressAndEndsWithTheTerminalPayload() {
        progressStore.start("c1");
        progressStore.appendThinking("c1", "Planning...");
        progressStore.appendMessageChunk("c1", "Use form A.");
        chatQueue.publishResponse(ResponsePayload.failed("c1", "t1", "Something went wrong."));

        StepVerifier.create(service.stream("c1"))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo(DefaultChatService.EVENT_THINKING);
                    assertThat(event.data()).contains("Planning...");
                })
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo(DefaultChatService.EVENT_MESSAGE);
                    assertThat(event.data()).contains("Use form A.");
                })
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo(DefaultChatService.EVENT_ERROR);
                    assertThat(event.id()).isEqualTo("c1");
                    assertThat(event.data()).contains("\"status\":\"failed\"");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void streamSendsKeepaliveWhileIdle() {
        DefaultChatService idle = service(Duration.ofMillis(20), Duration.ofSeconds(5));

        StepVerifier.create(idle.stream("c1"))
                .assertNext(event -> assertThat(event.comment()).isEqualTo("keepalive"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void streamGivesUpAfterTheLifetimeCap() {
        DefaultChatService capped = service(Duration.ofSeconds(15), Duration.ofMillis(50));

        StepVerifier.create(capped.stream("c1"))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo(DefaultChatService.EVENT_ERROR);
                    assertThat(event.data()).contains(DefaultChatService.TIMEOUT_MESSAGE);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void planLookupFailsForUnknownIds() {
        Plan plan = new Plan(List.of(), List.of("Planning..."), null);
        planStore.store("c1", plan);

        assertThat(service.plan("c1")).isEqualTo(plan);
        assertThatThrownBy(() -> service.plan("c2")).isInstanceOf(PlanNotFoundException.class);
    }
}
