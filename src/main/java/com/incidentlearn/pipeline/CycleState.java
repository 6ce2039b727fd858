package com.incidentlearn.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.incidentlearn.training.TrainingHyperparameters;

/**
 * Durable state of one family's learning cycles. Persisted after every phase transition; a cycle whose phase is
 * still in progress when the process starts is resumed from {@link #checkpoint}.
 */
public class CycleState {
    public String family;
    public long cycleId;
    public CyclePhase phase;
    public Instant startedAt;
    public Instant updatedAt;
    public Instant completedAt;
    public Checkpoint checkpoint = new Checkpoint();
    public boolean paused;
    public int windowMultiplier = 1;
    public long totalCycles;
    public long completedCycles;
    public long failedCycles;
    public CycleOutcome lastOutcome;
    public String rationale;
    public String lastError;

    public boolean inProgress() {
        return phase != null && phase.inProgress();
    }

    public static class Checkpoint {
        public Instant windowStart;
        public Instant windowEnd;
        public int feedbackCount;
        public List<String> patternIds = new ArrayList<>();
        public String planReason;
        public List<TrainingHyperparameters> candidateConfigurations = new ArrayList<>();
        public List<Long> candidateIds = new ArrayList<>();
        public Long selectedModelId;
        public String testId;
        public int experimentAttempt = 1;
        public boolean bootstrap;
        public boolean safetyAbort;
        public Long degradedModelId;
        public String forceRetrainReason;
    }
}
