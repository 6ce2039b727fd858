package com.incidentlearn.training;

import java.util.List;

public record ClassificationMetrics(
        double accuracy,
        double precision,
        double recall,
        double f1,
        long support) {

    public static final String ACCURACY = "accuracy";
    public static final String PRECISION = "precision";
    public static final String RECALL = "recall";
    public static final String F1 = "f1";

    public static ClassificationMetrics evaluate(TrainedModel model, List<TrainingExample> examples) {
        long tp = 0;
        long fp = 0;
        long tn = 0;
        long fn = 0;
        for (TrainingExample example : examples) {
            boolean predicted = model.predict(example);
            if (predicted && example.label()) {
                tp++;
            } else if (predicted) {
                fp++;
            } else if (example.label()) {
                fn++;
            } else {
                tn++;
            }
        }
        long total = tp + fp + tn + fn;
        double accuracy = total == 0 ? 0.0 : (double) (tp + tn) / total;
        double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
        double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
        double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return new ClassificationMetrics(accuracy, precision, recall, f1, total);
    }

    public double metric(String name) {
        return switch (name) {
            case ACCURACY -> accuracy;
            case PRECISION -> precision;
            case RECALL -> recall;
            case F1 -> f1;
            default -> throw new IllegalArgumentException("Unknown metric " + name);
        };
    }
}
