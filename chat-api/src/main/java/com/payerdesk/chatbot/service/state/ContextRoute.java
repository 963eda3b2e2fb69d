package com.payerdesk.chatbot.service.state;

public enum ContextRoute {
    /** No carried context; the message is read on its own. */
    STANDALONE,
    LIGHT,
    STATEFUL
}
