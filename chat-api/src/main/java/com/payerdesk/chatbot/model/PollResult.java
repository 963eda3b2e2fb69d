package com.payerdesk.chatbot.model;

/**
 * Anything the poll endpoint may answer with: a pending/processing snapshot or the terminal payload.
 */
public interface PollResult {

    ResponseStatus status();
}
