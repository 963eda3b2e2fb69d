package com.payerdesk.chatbot.service.orchestration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Component
@EnableConfigurationProperties(CostProperties.class)
public class CostModel {

    private final Map<String, CostProperties.Rate> rates = new HashMap<>();

    public CostModel(CostProperties properties) {
        for (CostProperties.Rate rate : properties.getRates()) {
            rates.put(key(rate.getProvider(), rate.getModel()), rate);
        }
    }

    /**
     * Unknown provider/model pairs cost nothing.
     */
    public double cost(LlmUsage usage) {
        if (usage == null) {
            return 0.0;
        }
        CostProperties.Rate rate = rates.get(key(usage.provider(), usage.model()));
        if (rate == null) {
            return 0.0;
        }
        return usage.inputTokens() / 1000.0 * rate.getInputPer1k()
                + usage.outputTokens() / 1000.0 * rate.getOutputPer1k();
    }

    private static String key(String provider, String model) {
        String p = provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
        String m = model == null ? "" : model.trim();
        return p + "|" + m;
    }
}
