package com.incidentlearn.training;

public interface TrainedModel {
    /** Probability that the suggestion resolves the incident. */
    double score(TrainingExample example);

    default boolean predict(TrainingExample example) {
        return score(example) >= 0.5;
    }
}
