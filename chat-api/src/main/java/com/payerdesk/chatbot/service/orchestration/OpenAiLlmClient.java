package com.payerdesk.chatbot.service.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.service.orchestration.openai.OpenAiChatClient;
import com.payerdesk.chatbot.service.orchestration.openai.OpenAiChatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
@Profile("!template")
public class OpenAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final String provider;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    public OpenAiLlmClient(OpenAiChatClient chatClient,
                           ObjectMapper objectMapper,
                           @Value("${chat.llm.provider:openai}") String provider,
                           @Value("${chat.llm.model:gpt-4o-mini}") String model,
                           @Value("${chat.llm.temperature:0.2}") double temperature,
                           @Value("${chat.llm.max-output-tokens:1500}") int maxOutputTokens) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.provider = Objects.requireNonNullElse(provider, "openai");
        this.model = Objects.requireNonNullElse(model, "gpt-4o-mini");
        this.temperature = temperature;
        this.maxOutputTokens = Math.max(256, maxOutputTokens);
    }

    @Override
    public LlmResult generate(LlmPrompt prompt) {
        Map<String, Object> params = prompt.jsonResponse()
                ? Map.of("response_format", Map.of("type", "json_object"))
                : Map.of();
        OpenAiChatClient.ChatCompletionResponse response = chatClient.complete(
                new OpenAiChatClient.Request(model, buildMessages(prompt), temperature, maxOutputTokens, params));
        OpenAiChatClient.Choice choice = response.firstChoice();
        if (choice == null || choice.message() == null || choice.message().content() == null
                || choice.message().content().isBlank()) {
            throw new OpenAiChatException("Chat completion returned no content");
        }
        String text = choice.message().content().trim();
        return new LlmResult(text, usageOf(response.usage(), prompt, text));
    }

    @Override
    public Flux<String> stream(LlmPrompt prompt) {
        return chatClient.stream(new OpenAiChatClient.Request(model, buildMessages(prompt), temperature, maxOutputTokens, Map.of()))
                .takeWhile(event -> !event.done())
                .concatMap(event -> {
                    try {
                        StreamResponse response = objectMapper.readValue(event.data(), StreamResponse.class);
                        StreamChoice choice = response.firstChoice();
                        if (choice == null || choice.delta() == null || choice.delta().content() == null
                                || choice.delta().content().isEmpty()) {
                            return Flux.empty();
                        }
                        return Flux.just(choice.delta().content());
                    } catch (JsonProcessingException e) {
                        log.warn("Failed to parse streaming chunk: {}", e.getOriginalMessage());
                        return Flux.empty();
                    }
                });
    }

    private LlmUsage usageOf(OpenAiChatClient.Usage usage, LlmPrompt prompt, String output) {
        if (usage == null) {
            int input = LlmUsage.estimateTokens(prompt.systemPrompt()) + LlmUsage.estimateTokens(prompt.userPrompt());
            return new LlmUsage(provider, model, input, LlmUsage.estimateTokens(output));
        }
        return new LlmUsage(provider, model, usage.promptTokens(), usage.completionTokens());
    }

    private List<OpenAiChatClient.Message> buildMessages(LlmPrompt prompt) {
        List<OpenAiChatClient.Message> messages = new ArrayList<>();
        if (prompt.systemPrompt() != null && !prompt.systemPrompt().isBlank()) {
            messages.add(new OpenAiChatClient.Message("system", prompt.systemPrompt()));
        }
        messages.add(new OpenAiChatClient.Message("user", prompt.userPrompt() == null ? "" : prompt.userPrompt().trim()));
        return List.copyOf(messages);
    }

    private record StreamResponse(List<StreamChoice> choices) {

        private StreamChoice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    private record StreamChoice(StreamDelta delta, @JsonProperty("finish_reason") String finishReason) {
    }

    private record StreamDelta(@JsonProperty("content") String content) {
    }
}
