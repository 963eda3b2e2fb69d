package com.payerdesk.chatbot.service.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.service.orchestration.openai.OpenAiChatClient;
import com.payerdesk.chatbot.service.orchestration.openai.OpenAiChatException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OpenAiLlmClientTest {

    private final OpenAiChatClient chatClient = mock(OpenAiChatClient.class);
    private final OpenAiLlmClient client = new OpenAiLlmClient(chatClient, new ObjectMapper(), "openai", "gpt-4o-mini", 0.2, 1500);

    @Test
    void generateReturnsTrimmedTextWithReportedUsage() {
        when(chatClient.complete(any())).thenReturn(response("  Use form A.  ", new OpenAiChatClient.Usage(10, 7, 3)));

        LlmResult result = client.generate(LlmPrompt.json("system", "user"));

        assertThat(result.text()).isEqualTo("Use form A.");
        assertThat(result.usage()).isEqualTo(new LlmUsage("openai", "gpt-4o-mini", 7, 3));

        ArgumentCaptor<OpenAiChatClient.Request> request = ArgumentCaptor.forClass(OpenAiChatClient.Request.class);
        verify(chatClient).complete(request.capture());
        assertThat(request.getValue().messages()).extracting(OpenAiChatClient.Message::role).containsExactly("system", "user");
        assertThat(request.getValue().extraParams()).containsEntry("response_format", Map.of("type", "json_object"));
    }

    @Test
    void generateEstimatesUsageWhenTheServerOmitsIt() {
        when(chatClient.complete(any())).thenReturn(response("abcdefgh", null));

        LlmResult result = client.generate(LlmPrompt.of(null, "abcd"));

        assertThat(result.usage()).isEqualTo(new LlmUsage("openai", "gpt-4o-mini", 2, 3));
    }

    @Test
    void blankCompletionIsAnError() {
        when(chatClient.complete(any())).thenReturn(response(" ", null));

        assertThatThrownBy(() -> client.generate(LlmPrompt.of("system", "user")))
                .isInstanceOf(OpenAiChatException.class);
    }

    @Test
    void streamEmitsDeltasUntilDone() {
        when(chatClient.stream(any())).thenReturn(Flux.just(
                new OpenAiChatClient.StreamEvent("{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}", false),
                new OpenAiChatClient.StreamEvent("not json", false),
                new OpenAiChatClient.StreamEvent("{\"choices\":[{\"delta\":{}}]}", false),
                new OpenAiChatClient.StreamEvent("{\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}", false),
                OpenAiChatClient.StreamEvent.DONE,
                new OpenAiChatClient.StreamEvent("{\"choices\":[{\"delta\":{\"content\":\"late\"}}]}", false)));

        StepVerifier.create(client.stream(LlmPrompt.of("system", "user")))
                .expectNext("Hel", "lo")
                .verifyComplete();
    }

    private static OpenAiChatClient.ChatCompletionResponse response(String content, OpenAiChatClient.Usage usage) {
        return new OpenAiChatClient.ChatCompletionResponse(
                List.of(new OpenAiChatClient.Choice(new OpenAiChatClient.Message("assistant", content), "stop")), usage);
    }
}
