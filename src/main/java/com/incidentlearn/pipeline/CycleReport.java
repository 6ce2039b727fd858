package com.incidentlearn.pipeline;

public record CycleReport(String family, long cycleId, CyclePhase phase, CycleOutcome outcome, String rationale, Long productionModelId) {
    static CycleReport of(CycleState state, Long productionModelId) {
        return new CycleReport(state.family, state.cycleId, state.phase, state.lastOutcome, state.rationale, productionModelId);
    }
}
