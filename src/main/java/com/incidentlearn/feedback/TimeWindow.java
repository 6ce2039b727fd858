package com.incidentlearn.feedback;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Closed interval {@code [start, end]}; a record stamped exactly at {@code end} belongs to the window. */
public record TimeWindow(Instant start, Instant end) {
    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow trailing(Instant end, Duration length) {
        return new TimeWindow(end.minus(length), end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }
}
