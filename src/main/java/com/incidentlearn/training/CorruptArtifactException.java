package com.incidentlearn.training;

public class CorruptArtifactException extends RuntimeException {
    public CorruptArtifactException(String message) {
        super(message);
    }

    public CorruptArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
