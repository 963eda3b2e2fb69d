package com.payerdesk.chatbot.service.memory;

public record ConversationMessage(String role, String content) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ConversationMessage user(String content) {
        return new ConversationMessage(ROLE_USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(ROLE_ASSISTANT, content);
    }
}
