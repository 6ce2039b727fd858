package com.incidentlearn.model;

import java.time.Instant;

/**
 * Versioned pointer to the serving model of one family; {@code modelId} is null before the first promotion.
 * {@code previousModelId} names the model a rollback would restore.
 */
public record ProductionPointer(String family, Long modelId, long version, Instant updatedAt, String reason, Long previousModelId) {
    public static ProductionPointer empty(String family) {
        return new ProductionPointer(family, null, 0L, null, null, null);
    }
}
