package com.payerdesk.chatbot.service.skills;

public record ScrapeResult(String url, String text, String summary) {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
