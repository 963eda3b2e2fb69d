package com.payerdesk.chatbot.service.progress;

import com.payerdesk.chatbot.model.ProgressEvent;

import java.util.List;

/**
 * Events read after a given offset, with the offset to pass on the next read.
 */
public record ProgressBatch(List<ProgressEvent> events, long nextOffset) {

    public ProgressBatch {
        events = List.copyOf(events);
    }

    public static ProgressBatch empty(long offset) {
        return new ProgressBatch(List.of(), offset);
    }
}
