package com.payerdesk.chatbot.service.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared change to a {@link ThreadState}. Active entries are shallow-merged, list fields replace, scalars replace.
 * A {@code null} list or scalar means "leave unchanged"; a present active entry with a {@code null} value clears it.
 */
public final class StateDelta {

    private static final Logger log = LoggerFactory.getLogger(StateDelta.class);

    private final Map<ActiveField, Object> active;
    private final List<String> openSlots;
    private final List<String> recentEntities;
    private final MessageClassification lastUserIntent;
    private final String refinedQuery;
    private final boolean refinedQueryPresent;
    private final Boolean patientAllowed;
    private final String resetReason;

    private StateDelta(Builder builder) {
        this.active = Collections.unmodifiableMap(new EnumMap<>(builder.active));
        this.openSlots = builder.openSlots == null ? null : List.copyOf(builder.openSlots);
        this.recentEntities = builder.recentEntities == null ? null : List.copyOf(builder.recentEntities);
        this.lastUserIntent = builder.lastUserIntent;
        this.refinedQuery = builder.refinedQuery;
        this.refinedQueryPresent = builder.refinedQueryPresent;
        this.patientAllowed = builder.patientAllowed;
        this.resetReason = builder.resetReason;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StateDelta none() {
        return builder().build();
    }

    public Map<ActiveField, Object> active() {
        return active;
    }

    public Optional<List<String>> openSlots() {
        return Optional.ofNullable(openSlots);
    }

    public Optional<List<String>> recentEntities() {
        return Optional.ofNullable(recentEntities);
    }

    public Optional<MessageClassification> lastUserIntent() {
        return Optional.ofNullable(lastUserIntent);
    }

    public boolean hasRefinedQuery() {
        return refinedQueryPresent;
    }

    public String refinedQuery() {
        return refinedQuery;
    }

    public Optional<Boolean> patientAllowed() {
        return Optional.ofNullable(patientAllowed);
    }

    public Optional<String> resetReason() {
        return Optional.ofNullable(resetReason);
    }

    public boolean clearsActive(ActiveField field) {
        return active.containsKey(field) && active.get(field) == null;
    }

    public static final class Builder {

        private final Map<ActiveField, Object> active = new EnumMap<>(ActiveField.class);
        private List<String> openSlots;
        private List<String> recentEntities;
        private MessageClassification lastUserIntent;
        private String refinedQuery;
        private boolean refinedQueryPresent;
        private Boolean patientAllowed;
        private String resetReason;

        private Builder() {
        }

        public Builder active(ActiveField field, Object value) {
            if (PatientDataFilter.looksIdentifying(value)) {
                log.debug("Dropped state value for {}: looks patient-identifying", field.key());
                return this;
            }
            active.put(field, value);
            return this;
        }

        public Builder clear(ActiveField field) {
            active.put(field, null);
            return this;
        }

        /**
         * Untyped entry point for extractor output keyed by name. Unknown or denied keys are dropped.
         */
        public Builder activeEntry(String key, Object value) {
            if (PatientDataFilter.isDeniedKey(key)) {
                log.debug("Dropped denied state key {}", key);
                return this;
            }
            Optional<ActiveField> field = ActiveField.fromKey(key);
            if (field.isEmpty()) {
                log.debug("Ignored unknown state key {}", key);
                return this;
            }
            return active(field.get(), value);
        }

        public Builder openSlots(List<String> slots) {
            this.openSlots = slots;
            return this;
        }

        public Builder recentEntities(List<String> entities) {
            this.recentEntities = entities == null ? null : entities.stream()
                    .filter(entity -> !PatientDataFilter.looksIdentifying(entity))
                    .toList();
            return this;
        }

        public Builder lastUserIntent(MessageClassification intent) {
            this.lastUserIntent = intent;
            return this;
        }

        public Builder refinedQuery(String query) {
            this.refinedQuery = PatientDataFilter.scrub(query);
            this.refinedQueryPresent = true;
            return this;
        }

        public Builder patientAllowed(boolean allowed) {
            this.patientAllowed = allowed;
            return this;
        }

        public Builder resetReason(String reason) {
            this.resetReason = reason;
            return this;
        }

        public boolean hasOpenSlots() {
            return openSlots != null;
        }

        public StateDelta build() {
            return new StateDelta(this);
        }
    }
}
