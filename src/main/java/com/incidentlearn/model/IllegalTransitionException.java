package com.incidentlearn.model;

public class IllegalTransitionException extends IllegalStateException {
    public IllegalTransitionException(long modelId, ModelStatus from, ModelStatus to) {
        super("Model " + modelId + " cannot move from " + from + " to " + to);
    }
}
