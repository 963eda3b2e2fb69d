package com.payerdesk.chatbot.service.orchestration;

import reactor.core.publisher.Flux;

/**
 * Text generation collaborator. Implementations signal failures with {@link LlmException}; callers own the fallback.
 */
public interface LlmClient {

    LlmResult generate(LlmPrompt prompt);

    Flux<String> stream(LlmPrompt prompt);
}
