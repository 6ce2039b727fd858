package com.incidentlearn.retraining;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.incidentlearn.training.ClassificationMetrics;
import com.incidentlearn.training.MetricEstimate;
import com.incidentlearn.training.ModelTrainer;
import com.incidentlearn.training.TrainingExample;
import com.incidentlearn.training.TrainingHyperparameters;

public class CrossValidator {
    private final ModelTrainer trainer;

    public CrossValidator(ModelTrainer trainer) {
        this.trainer = Objects.requireNonNull(trainer, "trainer");
    }

    public Result crossValidate(List<TrainingExample> examples, int k, TrainingHyperparameters hyperparameters, Path workDirectory)
            throws IOException {
        List<List<TrainingExample>> folds = StratifiedSplitter.folds(examples, k, hyperparameters.seed());
        List<ClassificationMetrics> perFold = new ArrayList<>();
        for (int i = 0; i < folds.size(); i++) {
            if (folds.get(i).isEmpty()) {
                continue;
            }
            List<TrainingExample> train = new ArrayList<>();
            for (int j = 0; j < folds.size(); j++) {
                if (j != i) {
                    train.addAll(folds.get(j));
                }
            }
            if (train.isEmpty()) {
                continue;
            }
            ModelTrainer.TrainingResult result = trainer.train(train, hyperparameters, workDirectory.resolve("fold-" + (i + 1)));
            perFold.add(ClassificationMetrics.evaluate(result.model(), folds.get(i)));
        }
        return new Result(perFold);
    }

    public record Result(List<ClassificationMetrics> folds) {
        public MetricEstimate estimate(String metric) {
            return MetricEstimate.of(folds.stream().map(fold -> fold.metric(metric)).toList());
        }
    }
}
