package com.incidentlearn.model;

public class ConcurrencyConflictException extends RuntimeException {
    private final Long expectedModelId;
    private final Long actualModelId;

    public ConcurrencyConflictException(String family, Long expectedModelId, Long actualModelId) {
        super("Production pointer for " + family + " moved: expected " + expectedModelId + " but found " + actualModelId);
        this.expectedModelId = expectedModelId;
        this.actualModelId = actualModelId;
    }

    public Long expectedModelId() {
        return expectedModelId;
    }

    public Long actualModelId() {
        return actualModelId;
    }
}
