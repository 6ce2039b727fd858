package com.incidentlearn.experiment;

import java.time.Instant;
import java.util.List;

public record ABTest(
        String id,
        String family,
        long controlModelId,
        long treatmentModelId,
        double trafficSplit,
        List<PrimaryMetric> primaryMetrics,
        List<GuardRailMetric> guardRails,
        double significanceLevel,
        long plannedSamplesPerVariant,
        int attempt,
        ABTestState state,
        Instant createdAt,
        Instant startedAt,
        Instant endsAt,
        Instant concludedAt,
        Decision decision,
        String rationale) {

    public ABTest {
        primaryMetrics = primaryMetrics == null ? List.of() : List.copyOf(primaryMetrics);
        guardRails = guardRails == null ? List.of() : List.copyOf(guardRails);
    }

    ABTest withState(ABTestState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("A/B test " + id + " cannot move from " + state + " to " + next);
        }
        return new ABTest(id, family, controlModelId, treatmentModelId, trafficSplit, primaryMetrics, guardRails, significanceLevel,
                plannedSamplesPerVariant, attempt, next, createdAt, startedAt, endsAt, concludedAt, decision, rationale);
    }

    ABTest started(Instant at, Instant ends) {
        ABTest running = withState(ABTestState.RUNNING);
        return new ABTest(id, family, controlModelId, treatmentModelId, trafficSplit, primaryMetrics, guardRails, significanceLevel,
                plannedSamplesPerVariant, attempt, running.state(), createdAt, at, ends, concludedAt, decision, rationale);
    }

    ABTest finished(ABTestState terminal, Decision outcome, String reason, Instant at) {
        ABTest done = withState(terminal);
        return new ABTest(id, family, controlModelId, treatmentModelId, trafficSplit, primaryMetrics, guardRails, significanceLevel,
                plannedSamplesPerVariant, attempt, done.state(), createdAt, startedAt, endsAt, at, outcome, reason);
    }
}
