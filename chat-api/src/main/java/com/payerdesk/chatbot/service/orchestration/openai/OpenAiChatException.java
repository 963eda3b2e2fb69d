package com.payerdesk.chatbot.service.orchestration.openai;

import com.payerdesk.chatbot.service.orchestration.LlmException;

public class OpenAiChatException extends LlmException {

    public OpenAiChatException(String message) {
        super(message);
    }

    public OpenAiChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
