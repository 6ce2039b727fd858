package com.incidentlearn.feedback;

import java.util.Locale;

public enum FeedbackOutcome {
    SUCCESS,
    FAILURE,
    UNKNOWN;

    public static FeedbackOutcome parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRecordException("feedback outcome is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("Outcome is not one of success|failure|unknown: " + value, e);
        }
    }
}
