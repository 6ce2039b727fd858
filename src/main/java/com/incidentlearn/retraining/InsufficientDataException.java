package com.incidentlearn.retraining;

public class InsufficientDataException extends RuntimeException {
    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Insufficient training data: " + available + " training samples available, " + required + " required");
        this.available = available;
        this.required = required;
    }

    public int available() {
        return available;
    }

    public int required() {
        return required;
    }
}
