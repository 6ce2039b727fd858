package com.incidentlearn.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.incidentlearn.feedback.TimeWindow;
import com.incidentlearn.training.OfflineMetrics;
import com.incidentlearn.training.TrainingHyperparameters;

public record ModelVersion(
        long id,
        Long parentId,
        String family,
        TimeWindow trainingDataWindow,
        TrainingHyperparameters hyperparameters,
        OfflineMetrics offlineMetrics,
        Instant createdAt,
        ModelStatus status,
        String artifactPath,
        String datasetPath,
        String rationale,
        int experimentAttempts,
        List<StatusChange> history) {

    public ModelVersion {
        history = history == null ? List.of() : List.copyOf(history);
    }

    ModelVersion withStatus(ModelStatus next, Instant at, String reason) {
        List<StatusChange> changes = new ArrayList<>(history);
        changes.add(new StatusChange(status, next, at, reason));
        String nextRationale = reason == null || reason.isBlank() ? rationale : reason;
        return new ModelVersion(id, parentId, family, trainingDataWindow, hyperparameters, offlineMetrics, createdAt, next,
                artifactPath, datasetPath, nextRationale, experimentAttempts, changes);
    }

    ModelVersion withExperimentAttempt() {
        return new ModelVersion(id, parentId, family, trainingDataWindow, hyperparameters, offlineMetrics, createdAt, status,
                artifactPath, datasetPath, rationale, experimentAttempts + 1, history);
    }
}
