package com.payerdesk.chatbot.service.state;

import java.util.List;

/**
 * Per-thread dialogue state. Only {@link DialogueStateMachine#applyDelta} produces a changed copy.
 */
public record ThreadState(ActiveContext active,
                          List<String> openSlots,
                          List<String> recentEntities,
                          MessageClassification lastUserIntent,
                          String refinedQuery,
                          Safety safety) {

    public ThreadState {
        active = active == null ? ActiveContext.empty() : active;
        openSlots = openSlots == null ? List.of() : List.copyOf(openSlots);
        recentEntities = recentEntities == null ? List.of() : List.copyOf(recentEntities);
        safety = safety == null ? Safety.defaults() : safety;
    }

    public static ThreadState empty() {
        return new ThreadState(ActiveContext.empty(), List.of(), List.of(), null, null, Safety.defaults());
    }

    public record Safety(boolean patientAllowed) {

        public static Safety defaults() {
            return new Safety(false);
        }
    }
}
