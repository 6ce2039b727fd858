package com.incidentlearn.metrics;

public enum AlertComparator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<=");

    private static final double EPSILON = 1e-9;

    private final String symbol;

    AlertComparator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double actual, double threshold) {
        return switch (this) {
            case GREATER_THAN -> actual > threshold;
            case LESS_THAN -> actual < threshold;
            case EQUALS -> Math.abs(actual - threshold) < EPSILON;
            case NOT_EQUALS -> Math.abs(actual - threshold) >= EPSILON;
            case GREATER_OR_EQUAL -> actual >= threshold;
            case LESS_OR_EQUAL -> actual <= threshold;
        };
    }
}
