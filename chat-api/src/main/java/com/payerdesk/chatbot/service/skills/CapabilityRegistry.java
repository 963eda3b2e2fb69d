package com.payerdesk.chatbot.service.skills;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canned answers for questions about what the assistant can do.
 */
@Component
public class CapabilityRegistry {

    private static final Map<String, String> ANSWERS = answers();

    public Optional<String> answerFor(String question) {
        String lower = question == null ? "" : question.trim().toLowerCase(Locale.ROOT);
        return ANSWERS.entrySet().stream()
                .filter(entry -> lower.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static Map<String, String> answers() {
        Map<String, String> answers = new LinkedHashMap<>();
        answers.put("what can you do", "I can help with: (1) Policy lookups from payer manuals and contracts, "
                + "such as appeals, grievances, prior auth, eligibility, claims and benefits. "
                + "(2) Web search when our materials don't cover your question. "
                + "(3) Web scraping when you provide a URL. "
                + "(4) General explanations and reasoning. I don't have access to your personal health records.");
        answers.put("can you search google", "Yes, I can search the web. When our materials don't cover your question, "
                + "I can look up information from the internet and cite those sources.");
        answers.put("can you scrape", "Yes, I can scrape web pages when you give me a URL. "
                + "I'll extract the content and summarize it for you.");
        answers.put("can you search", "Yes, I can search the web when our policy materials don't have the answer. "
                + "I'll use external search to complement our corpus and cite those sources.");
        return answers;
    }
}
