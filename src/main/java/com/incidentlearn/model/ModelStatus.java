package com.incidentlearn.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle {@code candidate -> gated -> experimenting -> production -> retired}. Rejection is terminal; an
 * inconclusive experiment returns the treatment to {@code candidate}.
 */
public enum ModelStatus {
    CANDIDATE,
    GATED,
    EXPERIMENTING,
    PRODUCTION,
    RETIRED,
    REJECTED;

    public Set<ModelStatus> successors() {
        return switch (this) {
            case CANDIDATE -> EnumSet.of(GATED, REJECTED);
            case GATED -> EnumSet.of(EXPERIMENTING, REJECTED);
            case EXPERIMENTING -> EnumSet.of(PRODUCTION, REJECTED, CANDIDATE);
            case PRODUCTION -> EnumSet.of(RETIRED);
            case RETIRED, REJECTED -> EnumSet.noneOf(ModelStatus.class);
        };
    }

    public boolean canTransitionTo(ModelStatus next) {
        return successors().contains(next);
    }

    public boolean terminal() {
        return successors().isEmpty();
    }
}
