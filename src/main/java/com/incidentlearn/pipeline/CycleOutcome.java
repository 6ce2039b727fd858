package com.incidentlearn.pipeline;

public enum CycleOutcome {
    PROMOTED,
    NOT_PROMOTED,
    SKIPPED,
    WAITING_FOR_EXPERIMENT,
    INSUFFICIENT_DATA,
    PAUSED,
    HALTED,
    FAILED
}
