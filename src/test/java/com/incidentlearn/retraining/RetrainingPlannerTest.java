package com.incidentlearn.retraining;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.incidentlearn.patterns.Pattern;
import com.incidentlearn.patterns.PatternKind;
import com.incidentlearn.training.TrainingHyperparameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrainingPlannerTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private final RetrainingPlanner planner = new RetrainingPlanner(List.of(TrainingHyperparameters.defaults()), 50, 0.5);

    @Test
    void shouldAlwaysTrainWithoutProductionModel() {
        RetrainingPlan plan = planner.plan(List.of(), 0, false);

        assertTrue(plan.retrain());
        assertEquals("no production model yet", plan.reason());
    }

    @Test
    void shouldSkipWhenNothingChanged() {
        RetrainingPlan plan = planner.plan(List.of(pattern(PatternKind.ANOMALY, 0.9), pattern(PatternKind.TREND, 0.3)), 49, true);

        assertFalse(plan.retrain());
        assertTrue(plan.candidates().isEmpty());
    }

    @Test
    void shouldTrainOnFeedbackVolume() {
        RetrainingPlan plan = planner.plan(List.of(), 50, true);

        assertTrue(plan.retrain());
        assertEquals(1, plan.candidates().size());
    }

    @Test
    void shouldForceRetrainOnEveryBaseConfiguration() {
        RetrainingPlan plan = planner.forced("Production model 4 degraded");

        assertTrue(plan.retrain());
        assertEquals("Production model 4 degraded", plan.reason());
        assertEquals(List.of(TrainingHyperparameters.defaults()), plan.candidates());
        assertTrue(plan.focusSubjects().isEmpty());
    }

    @Test
    void shouldAddLongerRunForNewClusters() {
        RetrainingPlan plan = planner.plan(List.of(pattern(PatternKind.NEW_CLUSTER, 0.8), pattern(PatternKind.BEHAVIOR_SHIFT, 0.6)), 0, true);

        assertEquals(List.of("NEW_CLUSTER:subject", "BEHAVIOR_SHIFT:subject"), plan.focusSubjects());
        assertEquals(2, plan.candidates().size());
        assertEquals(20, plan.candidates().get(1).epochs());
    }

    private static Pattern pattern(PatternKind kind, double confidence) {
        return Pattern.detected(kind, "subject", null, confidence, NOW);
    }
}
