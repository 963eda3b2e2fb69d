package com.payerdesk.chatbot.model;

import java.time.Instant;
import java.util.Map;

public record ProgressEvent(Type event, Map<String, Object> data) {

    public enum Type {
        THINKING("thinking"),
        MESSAGE("message"),
        MESSAGE_RESET("message_reset");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public static ProgressEvent thinking(String line) {
        return new ProgressEvent(Type.THINKING, Map.of("line", line, "ts", Instant.now().toEpochMilli()));
    }

    public static ProgressEvent message(String chunk) {
        return new ProgressEvent(Type.MESSAGE, Map.of("chunk", chunk));
    }

    /**
     * Tells streaming clients to drop the message chunks received so far.
     */
    public static ProgressEvent messageReset() {
        return new ProgressEvent(Type.MESSAGE_RESET, Map.of());
    }
}
