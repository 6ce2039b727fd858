package com.incidentlearn.training;

import java.time.Instant;

public record TrainingRunMetadata(
        String runId,
        Instant startedAt,
        long durationMillis,
        String datasetHash,
        int trainingExamples,
        int holdoutExamples,
        int futureExamples,
        TrainingHyperparameters hyperparameters,
        String trainerName,
        String notes) {
}
