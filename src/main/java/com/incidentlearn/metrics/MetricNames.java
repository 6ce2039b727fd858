package com.incidentlearn.metrics;

public final class MetricNames {
    public static final String FEEDBACK_TOTAL = "feedback.total_collected";
    public static final String FEEDBACK_SATISFACTION = "feedback.satisfaction";
    public static final String FEEDBACK_REJECTED = "feedback.rejected_count";
    public static final String FEEDBACK_ARCHIVED = "feedback.archived_count";

    public static final String PATTERNS_NEW_TYPES = "patterns.new_types_discovered";
    public static final String PATTERNS_BEHAVIOR_CHANGES = "patterns.behavior_changes_detected";
    public static final String PATTERNS_TRENDS = "patterns.trends_identified";
    public static final String PATTERNS_CORRELATIONS = "patterns.correlations_found";
    public static final String PATTERNS_ANOMALIES = "patterns.anomalies_detected";
    public static final String PATTERNS_DETECTOR_FAILURES = "patterns.detector_failures";

    public static final String MODELS_RETRAINED = "models.retrained_count";
    public static final String MODELS_REJECTED = "models.rejected_count";
    public static final String MODELS_PROMOTED = "models.promoted_count";
    public static final String MODELS_TRAINING_DURATION = "models.training_duration";
    public static final String MODELS_ROLLED_BACK = "models.rolled_back_count";
    public static final String MODELS_LIVE_ACCURACY = "models.live_accuracy";
    public static final String VALIDATION_PASSED = "validation.passed_count";
    public static final String VALIDATION_FAILED = "validation.failed_count";

    public static final String ABTESTS_ACTIVE = "abtests.active_count";
    public static final String ABTESTS_COMPLETED = "abtests.completed_count";
    public static final String ABTESTS_ABORTED = "abtests.aborted_count";
    public static final String ABTESTS_SAMPLES = "abtests.samples_recorded";

    public static final String CYCLE_DURATION = "learning.cycle_duration";
    public static final String CYCLES_COMPLETED = "learning.cycles_completed";
    public static final String CYCLES_FAILED = "learning.cycles_failed";

    private MetricNames() {
    }

    public static String perSourceFeedback(String source) {
        return "feedback." + source + "_feedback_count";
    }
}
