package com.incidentlearn.training;

import java.time.Instant;
import java.util.Map;

/**
 * One labelled suggestion outcome. {@code label} is true when the suggested solution resolved the incident;
 * {@code groups} carries the attributes fairness is measured over.
 */
public record TrainingExample(
        String id,
        String text,
        String suggestedSolutionId,
        boolean label,
        Instant observedAt,
        Map<String, String> groups) {

    public TrainingExample {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("training example id is required");
        }
        text = text == null ? "" : text;
        groups = groups == null ? Map.of() : Map.copyOf(groups);
    }

    public TrainingExample withText(String value) {
        return new TrainingExample(id, value, suggestedSolutionId, label, observedAt, groups);
    }
}
