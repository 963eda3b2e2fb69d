package com.payerdesk.chatbot.service.state;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "chat.payers")
public class PayerProperties {

    /**
     * Payer names recognised in user text, matched case-insensitively on word boundaries.
     */
    private List<String> names = new ArrayList<>(List.of(
            "Sunshine Health", "Sunshine", "UnitedHealthcare", "United Healthcare", "UHC",
            "Aetna", "Humana", "Cigna", "Anthem", "Blue Cross", "Molina"));

    /**
     * Alias to canonical payer token used for retrieval filters.
     */
    private Map<String, String> aliases = new LinkedHashMap<>(Map.of(
            "UHC", "UnitedHealthcare",
            "United Healthcare", "UnitedHealthcare",
            "Sunshine", "Sunshine Health"));

    public List<String> getNames() {
        return names;
    }

    public void setNames(List<String> names) {
        this.names = names;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public void setAliases(Map<String, String> aliases) {
        this.aliases = aliases;
    }
}
