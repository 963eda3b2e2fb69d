package com.payerdesk.chatbot.service.planner;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "chat.planner")
public class PlannerProperties {

    private List<String> separators = new ArrayList<>(List.of(" and ", " also ", " then "));

    /**
     * Phrases that mark a question about the user's own record, which this service cannot answer.
     */
    private List<String> patientKeywords = new ArrayList<>(List.of(
            "my doctor", "my medication", "my visit", "my record", "my records", "my care",
            "what did my doctor", "do i qualify", "do we qualify", "my eligibility", "based on my",
            "my enrollment", "my coverage", "am i eligible", "are we eligible"));

    private List<String> toolPhrases = new ArrayList<>(List.of(
            "what can you do", "search google", "google search", "web scrape", "scrape", "search for",
            "look up", "find information about", "search the web"));

    private List<String> reasoningPrefixes = new ArrayList<>(List.of(
            "why ", "what does", "what is the difference", "what's the difference", "explain the difference"));

    private boolean llmDecompositionEnabled = false;

    private int defaultRagK = 10;

    public List<String> getSeparators() {
        return separators;
    }

    public void setSeparators(List<String> separators) {
        this.separators = separators;
    }

    public List<String> getPatientKeywords() {
        return patientKeywords;
    }

    public void setPatientKeywords(List<String> patientKeywords) {
        this.patientKeywords = patientKeywords;
    }

    public List<String> getToolPhrases() {
        return toolPhrases;
    }

    public void setToolPhrases(List<String> toolPhrases) {
        this.toolPhrases = toolPhrases;
    }

    public List<String> getReasoningPrefixes() {
        return reasoningPrefixes;
    }

    public void setReasoningPrefixes(List<String> reasoningPrefixes) {
        this.reasoningPrefixes = reasoningPrefixes;
    }

    public boolean isLlmDecompositionEnabled() {
        return llmDecompositionEnabled;
    }

    public void setLlmDecompositionEnabled(boolean llmDecompositionEnabled) {
        this.llmDecompositionEnabled = llmDecompositionEnabled;
    }

    public int getDefaultRagK() {
        return defaultRagK;
    }

    public void setDefaultRagK(int defaultRagK) {
        this.defaultRagK = defaultRagK;
    }
}
