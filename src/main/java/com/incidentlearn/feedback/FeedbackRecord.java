package com.incidentlearn.feedback;

import java.time.Duration;
import java.time.Instant;

public record FeedbackRecord(
        String incidentId,
        FeedbackSource source,
        String suggestedSolutionId,
        String actualSolution,
        FeedbackOutcome outcome,
        Integer rating,
        Duration latencyToResolution,
        Instant recordedAt) {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    public FeedbackRecord {
        if (incidentId == null || incidentId.isBlank()) {
            throw new InvalidRecordException("incident_id is required");
        }
        if (source == null) {
            throw new InvalidRecordException("source is required for incident " + incidentId);
        }
        if (outcome == null) {
            throw new InvalidRecordException("outcome is required for incident " + incidentId);
        }
        if (recordedAt == null) {
            throw new InvalidRecordException("recorded_at is required for incident " + incidentId);
        }
        if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
            throw new InvalidRecordException("rating must be within [1, 5] for incident " + incidentId + ": " + rating);
        }
        if (latencyToResolution != null && latencyToResolution.isNegative()) {
            throw new InvalidRecordException("latency_to_resolution must be >= 0 for incident " + incidentId);
        }
    }

    public FeedbackRecord withActualSolution(String value) {
        return new FeedbackRecord(incidentId, source, suggestedSolutionId, value, outcome, rating, latencyToResolution, recordedAt);
    }

    public boolean resolved() {
        return outcome != FeedbackOutcome.UNKNOWN;
    }
}
