package com.incidentlearn.experiment;

import java.util.EnumSet;
import java.util.Set;

public enum ABTestState {
    DRAFT,
    RUNNING,
    ANALYZING,
    CONCLUDED,
    ABORTED;

    public Set<ABTestState> successors() {
        return switch (this) {
            case DRAFT -> EnumSet.of(RUNNING, ABORTED);
            case RUNNING -> EnumSet.of(ANALYZING, ABORTED);
            case ANALYZING -> EnumSet.of(CONCLUDED, ABORTED);
            case CONCLUDED, ABORTED -> EnumSet.noneOf(ABTestState.class);
        };
    }

    public boolean canTransitionTo(ABTestState next) {
        return successors().contains(next);
    }

    public boolean terminal() {
        return successors().isEmpty();
    }

    public boolean active() {
        return !terminal();
    }
}
