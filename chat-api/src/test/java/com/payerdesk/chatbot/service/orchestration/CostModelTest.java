package com.payerdesk.chatbot.service.orchestration;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CostModelTest {

    private final CostModel costModel = new CostModel(properties());

    @Test
    void pricesInputAndOutputTokensSeparately() {
        double cost = costModel.cost(new LlmUsage("OpenAI", "gpt-4o-mini", 2000, 1000));

        assertThat(cost).isCloseTo(2 * 0.00015 + 0.0006, within(1e-9));
    }

    @Test
    void unknownModelOrMissingUsageIsFree() {
        assertThat(costModel.cost(new LlmUsage("openai", "unknown-model", 5000, 5000))).isZero();
        assertThat(costModel.cost(null)).isZero();
    }

    private static CostProperties properties() {
        CostProperties properties = new CostProperties();
        properties.setRates(List.of(new CostProperties.Rate("openai", "gpt-4o-mini", 0.00015, 0.0006)));
        return properties;
    }
}
