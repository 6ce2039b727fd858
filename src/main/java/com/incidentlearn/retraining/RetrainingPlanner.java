package com.incidentlearn.retraining;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.incidentlearn.patterns.Pattern;
import com.incidentlearn.patterns.PatternKind;
import com.incidentlearn.training.TrainingHyperparameters;

/** Decides from detected patterns and feedback volume whether a cycle retrains, and with which configurations. */
public class RetrainingPlanner {
    private static final Set<PatternKind> RETRAIN_TRIGGERS = EnumSet.of(PatternKind.NEW_CLUSTER, PatternKind.BEHAVIOR_SHIFT, PatternKind.TREND);

    private final List<TrainingHyperparameters> baseConfigurations;
    private final int feedbackThreshold;
    private final double minPatternConfidence;

    public RetrainingPlanner(List<TrainingHyperparameters> baseConfigurations, int feedbackThreshold, double minPatternConfidence) {
        if (baseConfigurations.isEmpty()) {
            throw new IllegalArgumentException("at least one base configuration is required");
        }
        this.baseConfigurations = List.copyOf(baseConfigurations);
        this.feedbackThreshold = feedbackThreshold;
        this.minPatternConfidence = minPatternConfidence;
    }

    public RetrainingPlan plan(List<Pattern> patterns, int feedbackCount, boolean hasProductionModel) {
        List<String> focus = patterns.stream()
                .filter(pattern -> RETRAIN_TRIGGERS.contains(pattern.kind()))
                .filter(pattern -> pattern.confidence() >= minPatternConfidence)
                .map(pattern -> pattern.kind() + ":" + pattern.subject())
                .toList();
        boolean newClusters = patterns.stream()
                .anyMatch(pattern -> pattern.kind() == PatternKind.NEW_CLUSTER && pattern.confidence() >= minPatternConfidence);

        String reason;
        if (!hasProductionModel) {
            reason = "no production model yet";
        } else if (!focus.isEmpty()) {
            reason = focus.size() + " pattern(s) above confidence " + minPatternConfidence;
        } else if (feedbackCount >= feedbackThreshold) {
            reason = feedbackCount + " feedback records reached threshold " + feedbackThreshold;
        } else {
            return RetrainingPlan.skip("no retraining trigger: " + feedbackCount + " feedback records, no significant patterns");
        }

        List<TrainingHyperparameters> candidates = new ArrayList<>(baseConfigurations);
        if (newClusters) {
            TrainingHyperparameters base = baseConfigurations.get(0);
            TrainingHyperparameters extended = new TrainingHyperparameters(base.epochs() * 2, base.learningRate(), base.batchSize(), base.l2(), base.seed());
            if (!candidates.contains(extended)) {
                candidates.add(extended);
            }
        }
        return new RetrainingPlan(true, reason, focus, candidates);
    }

    /** A plan that retrains on every base configuration regardless of patterns, e.g. after a rollback. */
    public RetrainingPlan forced(String reason) {
        return new RetrainingPlan(true, reason, List.of(), baseConfigurations);
    }
}
