package com.incidentlearn.training;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Uniform training interface; any supervised binary classifier qualifies. */
public interface ModelTrainer {
    String name();

    TrainingResult train(List<TrainingExample> dataset, TrainingHyperparameters hyperparameters, Path runDirectory) throws IOException;

    /** Reads an artifact written by {@link #train}; throws {@link CorruptArtifactException} when it cannot be trusted. */
    TrainedModel load(Path artifactPath) throws IOException;

    record TrainingResult(TrainedModel model, Path artifactPath, String trainerName, String notes) {
    }
}
