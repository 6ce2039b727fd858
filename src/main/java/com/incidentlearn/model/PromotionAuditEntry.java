package com.incidentlearn.model;

import java.time.Instant;

public record PromotionAuditEntry(
        Instant timestamp,
        String family,
        String actor,
        String reason,
        Kind kind,
        Long previousModelId,
        long newModelId,
        String testId,
        long pointerVersion) {

    public enum Kind {
        EXPERIMENT_ADOPTED,
        BOOTSTRAP,
        FORCED,
        ROLLBACK
    }
}
