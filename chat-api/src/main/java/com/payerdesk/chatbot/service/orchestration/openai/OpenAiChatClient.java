package com.payerdesk.chatbot.service.orchestration.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Transport for OpenAI-compatible {@code /v1/chat/completions} endpoints, blocking and streaming.
 */
@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final WebClient webClient;
    private final Duration timeout;
    private final boolean configured;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${chat.llm.base-url:}") String baseUrl,
                            @Value("${chat.llm.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        this.configured = baseUrl != null && !baseUrl.isBlank();
    }

    public ChatCompletionResponse complete(Request request) {
        requireConfigured();
        try {
            ChatCompletionResponse response = webClient.post()
                    .uri(COMPLETIONS_PATH)
                    .bodyValue(payload(request, false))
                    .retrieve()
                    .bodyToMono(ChatCompletionResponse.class)
                    .timeout(timeout)
                    .block(timeout.plusSeconds(1));
            if (response == null) {
                throw new OpenAiChatException("Chat completion returned no body");
            }
            return response;
        } catch (WebClientResponseException ex) {
            throw wrap(ex);
        } catch (OpenAiChatException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("LLM chat completion failed: {}", ex.getMessage());
            throw new OpenAiChatException("Failed to invoke chat completion", ex);
        }
    }

    public Flux<StreamEvent> stream(Request request) {
        if (!configured) {
            return Flux.error(new OpenAiChatException("LLM endpoint is not configured"));
        }
        return webClient.post()
                .uri(COMPLETIONS_PATH)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload(request, true))
                .retrieve()
                .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .timeout(timeout)
                .map(ServerSentEvent::data)
                .filter(data -> data != null && !data.isBlank())
                .map(data -> {
                    String trimmed = data.trim();
                    return "[DONE]".equals(trimmed) ? StreamEvent.DONE : new StreamEvent(trimmed, false);
                })
                .onErrorMap(WebClientResponseException.class, this::wrap)
                .onErrorMap(ex -> ex instanceof OpenAiChatException ? ex : new OpenAiChatException("Failed to stream chat completion", ex));
    }

    private Map<String, Object> payload(Request request, boolean stream) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", stream);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }
        if (request.extraParams() != null && !request.extraParams().isEmpty()) {
            payload.putAll(request.extraParams());
        }
        return payload;
    }

    private void requireConfigured() {
        if (!configured) {
            throw new OpenAiChatException("LLM endpoint is not configured");
        }
    }

    private OpenAiChatException wrap(WebClientResponseException exception) {
        HttpStatusCode status = exception.getStatusCode();
        log.warn("LLM chat completion returned {}", status.value());
        return new OpenAiChatException("Chat completion returned " + status.value(), exception);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens,
                          Map<String, Object> extraParams) {
    }

    public record Message(String role, String content) {
    }

    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    public record Usage(@JsonProperty("total_tokens") int totalTokens,
                        @JsonProperty("prompt_tokens") int promptTokens,
                        @JsonProperty("completion_tokens") int completionTokens) {
    }

    public record StreamEvent(String data, boolean done) {

        public static final StreamEvent DONE = new StreamEvent("[DONE]", true);
    }
}
