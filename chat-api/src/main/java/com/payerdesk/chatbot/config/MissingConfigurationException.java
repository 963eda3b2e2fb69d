package com.payerdesk.chatbot.config;

/**
 * A strictly required collaborator or setting is absent or invalid. Raised at startup only.
 */
public class MissingConfigurationException extends RuntimeException {

    public MissingConfigurationException(String message) {
        super(message);
    }
}
