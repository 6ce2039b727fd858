package com.incidentlearn.corpus;

import java.time.Duration;
import java.time.Instant;

public record IncidentObservation(
        String incidentId,
        String category,
        String system,
        String description,
        String severity,
        Instant occurredAt,
        Duration resolutionTime) {

    public IncidentObservation {
        if (incidentId == null || incidentId.isBlank()) {
            throw new IllegalArgumentException("incidentId is required");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt is required for incident " + incidentId);
        }
        category = category == null || category.isBlank() ? "uncategorized" : category;
        system = system == null || system.isBlank() ? "unknown" : system;
        description = description == null ? "" : description;
    }
}
