package com.incidentlearn.pipeline;

public enum CyclePhase {
    AGGREGATING,
    ANALYZING,
    RETRAINING,
    VALIDATING,
    EXPERIMENTING,
    DEPLOYING,
    COMPLETED,
    FAILED;

    public boolean inProgress() {
        return this != COMPLETED && this != FAILED;
    }
}
