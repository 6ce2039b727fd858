package com.incidentlearn.patterns;

import java.time.Instant;
import java.util.Objects;

/**
 * A derived observation about the incident stream. Patterns are never overwritten: a later pattern for the same
 * kind and subject links to the one it supersedes.
 */
public record Pattern(
        String id,
        PatternKind kind,
        String subject,
        PatternEvidence evidence,
        double confidence,
        Instant detectedAt,
        String supersedes) {

    public Pattern {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detectedAt, "detectedAt");
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("pattern subject is required");
        }
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("pattern confidence must be a number");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        evidence = evidence == null ? new PatternEvidence(null, null, null) : evidence;
    }

    public static Pattern detected(PatternKind kind, String subject, PatternEvidence evidence, double confidence, Instant detectedAt) {
        return new Pattern(null, kind, subject, evidence, confidence, detectedAt, null);
    }

    public Pattern withLineage(String assignedId, String supersededId) {
        return new Pattern(assignedId, kind, subject, evidence, confidence, detectedAt, supersededId);
    }
}
