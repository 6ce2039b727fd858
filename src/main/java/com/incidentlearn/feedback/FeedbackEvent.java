package com.incidentlearn.feedback;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Inbound suggestion-outcome event as delivered by upstream producers.
 *
 * <p>{@code latency_to_resolution} accepts either seconds or an ISO-8601 duration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedbackEvent(
        String incidentId,
        String source,
        String suggestedSolutionId,
        String actualSolution,
        String outcome,
        Integer rating,
        String latencyToResolution,
        String recordedAt) {

    public FeedbackRecord toRecord(Clock clock) {
        return new FeedbackRecord(
                incidentId == null ? null : incidentId.trim(),
                FeedbackSource.parse(source),
                suggestedSolutionId,
                actualSolution,
                FeedbackOutcome.parse(outcome),
                rating,
                parseLatency(),
                parseRecordedAt(clock));
    }

    private Duration parseLatency() {
        if (latencyToResolution == null || latencyToResolution.isBlank()) {
            return null;
        }
        String value = latencyToResolution.trim();
        try {
            if (value.startsWith("P") || value.startsWith("p")) {
                return Duration.parse(value);
            }
            return Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new InvalidRecordException("latency_to_resolution is not a duration: " + value, e);
        }
    }

    private Instant parseRecordedAt(Clock clock) {
        if (recordedAt == null || recordedAt.isBlank()) {
            return clock.instant();
        }
        try {
            return Instant.parse(recordedAt.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException("recorded_at is not an ISO-8601 instant: " + recordedAt, e);
        }
    }
}
