package com.payerdesk.chatbot.service.memory;

public class ConversationStoreException extends RuntimeException {

    public ConversationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
