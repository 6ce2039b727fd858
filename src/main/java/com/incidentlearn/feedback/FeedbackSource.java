package com.incidentlearn.feedback;

import java.util.Locale;

public enum FeedbackSource {
    OPERATOR,
    USER,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FeedbackSource parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRecordException("feedback source is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("Unknown feedback source: " + value, e);
        }
    }
}
