package com.payerdesk.chatbot.service.state;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hard barrier between user text and persisted thread state: names, birth dates and record identifiers never pass.
 */
public final class PatientDataFilter {

    private static final Set<String> DENIED_KEYS = Set.of(
            "name", "patient_name", "first_name", "last_name", "full_name",
            "dob", "date_of_birth", "birth_date", "birthdate",
            "mrn", "medical_record_number", "member_id", "subscriber_id", "ssn", "patient_id");

    private static final List<Pattern> IDENTIFYING_VALUES = List.of(
            Pattern.compile("\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b"),
            Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b"),
            Pattern.compile("\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2},?\\s+\\d{4}\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d{6,}"),
            Pattern.compile("\\b(mrn|dob|ssn|date of birth|member id|medical record)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bmy name is\\b", Pattern.CASE_INSENSITIVE));

    private PatientDataFilter() {
    }

    public static boolean isDeniedKey(String key) {
        return key != null && DENIED_KEYS.contains(key.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * The text itself, or {@code null} when it carries anything patient-identifying.
     */
    public static String scrub(String text) {
        return looksIdentifying(text) ? null : text;
    }

    public static boolean looksIdentifying(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                if (looksIdentifying(item)) {
                    return true;
                }
            }
            return false;
        }
        if (value instanceof Jurisdiction jurisdiction) {
            return looksIdentifying(jurisdiction.payor())
                    || looksIdentifying(jurisdiction.state())
                    || looksIdentifying(jurisdiction.program())
                    || looksIdentifying(jurisdiction.perspective())
                    || looksIdentifying(jurisdiction.regulatoryAgency());
        }
        String text = value.toString();
        return IDENTIFYING_VALUES.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }
}
