package com.incidentlearn.training;

public record TrainingHyperparameters(
        int epochs,
        double learningRate,
        int batchSize,
        double l2,
        long seed) {

    public TrainingHyperparameters {
        if (epochs <= 0 || batchSize <= 0) {
            throw new IllegalArgumentException("epochs and batchSize must be > 0");
        }
        if (learningRate <= 0.0 || l2 < 0.0) {
            throw new IllegalArgumentException("learningRate must be > 0 and l2 >= 0");
        }
    }

    public static TrainingHyperparameters defaults() {
        return new TrainingHyperparameters(10, 0.1, 32, 0.0001, 42L);
    }
}
