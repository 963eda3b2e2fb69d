package com.payerdesk.chatbot.service.skills;

public record SearchSnippet(String title, String snippet, String url) {

    public String text() {
        String body = snippet == null ? "" : snippet;
        return title == null || title.isBlank() ? body : (title + "\n" + body).trim();
    }

    public String displayName() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return url != null && !url.isBlank() ? url : "External";
    }
}
