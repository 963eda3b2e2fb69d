package com.payerdesk.chatbot.service.orchestration;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateLlmClientTest {

    private final TemplateLlmClient client = new TemplateLlmClient();

    @Test
    void answersFromTheNumberedContextLines() {
        LlmResult result = client.generate(LlmPrompt.of("system",
                "Question: appeals?\n[1] File within 60 days.\n[2] Use form A.\nOther text"));

        assertThat(result.text()).isEqualTo("Here is what the available material says:\n"
                + "- [1] File within 60 days.\n- [2] Use form A.");
        assertThat(result.usage().provider()).isEqualTo("template");
    }

    @Test
    void jsonPromptsGetAnEmptyObject() {
        assertThat(client.generate(LlmPrompt.json("system", "plan this")).text()).isEqualTo("{}");
    }

    @Test
    void streamSplitsOnLines() {
        StepVerifier.create(client.stream(LlmPrompt.of("system", "[1] A\n[2] B")))
                .expectNext("Here is what the available material says:\n", "- [1] A\n", "- [2] B")
                .verifyComplete();
    }
}
