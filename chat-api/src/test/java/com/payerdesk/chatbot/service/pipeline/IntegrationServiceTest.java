package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.service.agents.AgentAnswer;
import com.payerdesk.chatbot.service.orchestration.LlmClient;
import com.payerdesk.chatbot.service.orchestration.LlmException;
import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.planner.QuestionIntent;
import com.payerdesk.chatbot.service.planner.QuestionKind;
import com.payerdesk.chatbot.service.planner.SubQuestion;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IntegrationServiceTest {

    private final LlmClient llmClient = mock(LlmClient.class);
    private final IntegrationService service = new IntegrationService(llmClient, "openai", "gpt-4o-mini", Duration.ofSeconds(5));
    private final List<String> chunks = new ArrayList<>();

    @Test
    void singleAnswerPassesThroughWithoutLlm() {
        IntegratedMessage message = service.integrate(plan(), List.of(answer("sq1", "Only answer")), "", chunks::add);

        assertThat(message.text()).isEqualTo("Only answer");
        assertThat(message.usage()).isNull();
        assertThat(chunks).containsExactly("Only answer");
        verifyNoInteractions(llmClient);
    }

    @Test
    void noAnswersYieldHeaderOnly() {
        IntegratedMessage message = service.integrate(plan(), List.of(), "", chunks::add);

        assertThat(message.text()).isEqualTo(IntegrationService.FALLBACK_HEADER);
    }

    @Test
    void severalAnswersAreStreamedAndEstimated() {
        when(llmClient.stream(any())).thenReturn(Flux.just("Part one. ", "Part two."));

        IntegratedMessage message = service.integrate(plan(), List.of(answer("sq1", "a"), answer("sq2", "b")), "ctx", chunks::add);

        assertThat(message.text()).isEqualTo("Part one. Part two.");
        assertThat(chunks).containsExactly("Part one. ", "Part two.");
        assertThat(message.usage().provider()).isEqualTo("openai");
        assertThat(message.usage().outputTokens()).isPositive();
    }

    @Test
    void streamFailureFallsBackToSectionedLayout() {
        when(llmClient.stream(any())).thenReturn(Flux.error(new LlmException("stream broke")));

        IntegratedMessage message = service.integrate(plan(),
                List.of(answer("sq1", "Use form A."), answer("sq2", "I don't have access to your personal records yet.")),
                "", chunks::add);

        assertThat(message.usage()).isNull();
        assertThat(message.text()).isEqualTo(IntegrationService.FALLBACK_HEADER + "\n\n"
                + "**sq1** (Policy/document): How do I appeal?\n→ Use form A.\n\n"
                + "**sq2** (Personal (we don't have access yet)): What did my doctor say?\n→ I don't have access to your personal records yet.");
        assertThat(chunks).containsExactly(message.text());
    }

    @Test
    void partialStreamIsResetBeforeTheSectionedLayout() {
        when(llmClient.stream(any())).thenReturn(Flux.concat(Flux.just("Part one. "),
                Flux.error(new LlmException("connection reset"))));
        AtomicInteger resets = new AtomicInteger();

        IntegratedMessage message = service.integrate(plan(), List.of(answer("sq1", "a"), answer("sq2", "b")), "",
                chunks::add, () -> {
                    resets.incrementAndGet();
                    chunks.clear();
                });

        assertThat(resets).hasValue(1);
        assertThat(chunks).containsExactly(message.text());
        assertThat(message.text()).startsWith(IntegrationService.FALLBACK_HEADER);
    }

    @Test
    void failureBeforeAnyChunkNeedsNoReset() {
        when(llmClient.stream(any())).thenReturn(Flux.error(new LlmException("refused")));
        AtomicInteger resets = new AtomicInteger();

        service.integrate(plan(), List.of(answer("sq1", "a"), answer("sq2", "b")), "", chunks::add, resets::incrementAndGet);

        assertThat(resets).hasValue(0);
    }

    private static Plan plan() {
        return new Plan(List.of(
                new SubQuestion("sq1", "How do I appeal?", QuestionKind.NON_PATIENT, QuestionIntent.CANONICAL, 0.0,
                        List.of(), null, true),
                new SubQuestion("sq2", "What did my doctor say?", QuestionKind.PATIENT, null, 0.5, List.of(), null, false)),
                List.of(), null);
    }

    private static AgentAnswer answer(String id, String text) {
        return AgentAnswer.withoutSources(id, text, null);
    }
}
