package com.incidentlearn.retraining;

import java.util.List;

import com.incidentlearn.training.TrainingHyperparameters;

public record RetrainingPlan(boolean retrain, String reason, List<String> focusSubjects, List<TrainingHyperparameters> candidates) {
    public RetrainingPlan {
        focusSubjects = List.copyOf(focusSubjects);
        candidates = List.copyOf(candidates);
    }

    public static RetrainingPlan skip(String reason) {
        return new RetrainingPlan(false, reason, List.of(), List.of());
    }
}
