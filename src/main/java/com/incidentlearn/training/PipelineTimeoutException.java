package com.incidentlearn.training;

import java.time.Duration;

public class PipelineTimeoutException extends RuntimeException {
    private final String stage;
    private final Duration budget;

    public PipelineTimeoutException(String stage, Duration budget) {
        super(stage + " exceeded its wall-clock budget of " + budget);
        this.stage = stage;
        this.budget = budget;
    }

    public String stage() {
        return stage;
    }

    public Duration budget() {
        return budget;
    }
}
