package com.payerdesk.chatbot.service.orchestration;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.Arrays;
import java.util.List;

/**
 * Deterministic stand-in for a hosted model: echoes the strongest context lines back as the answer.
 */
@Component
@Profile("template")
public class TemplateLlmClient implements LlmClient {

    private static final String PROVIDER = "template";
    private static final String MODEL = "template-v1";

    @Override
    public LlmResult generate(LlmPrompt prompt) {
        String answer = prompt.jsonResponse() ? "{}" : synthesizeAnswer(prompt.userPrompt());
        int input = LlmUsage.estimateTokens(prompt.systemPrompt()) + LlmUsage.estimateTokens(prompt.userPrompt());
        return new LlmResult(answer, new LlmUsage(PROVIDER, MODEL, input, LlmUsage.estimateTokens(answer)));
    }

    @Override
    public Flux<String> stream(LlmPrompt prompt) {
        String answer = synthesizeAnswer(prompt.userPrompt());
        return Flux.fromIterable(Arrays.asList(answer.split("(?<=\\n)")));
    }

    private String synthesizeAnswer(String userPrompt) {
        if (userPrompt == null || userPrompt.isBlank()) {
            return "I don't have enough information to answer that.";
        }
        List<String> contextLines = userPrompt.lines()
                .map(String::trim)
                .filter(line -> line.startsWith("["))
                .limit(3)
                .toList();
        StringBuilder builder = new StringBuilder("Here is what the available material says:\n");
        if (contextLines.isEmpty()) {
            builder.append(normalise(userPrompt)).append('\n');
        } else {
            contextLines.forEach(line -> builder.append("- ").append(normalise(line)).append('\n'));
        }
        return builder.toString().trim();
    }

    private String normalise(String text) {
        String trimmed = text.replaceAll("\\s+", " ").trim();
        if (trimmed.length() <= 240) {
            return trimmed;
        }
        return trimmed.substring(0, 237) + "...";
    }
}
