package com.incidentlearn.pipeline;

import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.incidentlearn.MutableClock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CycleGovernorTest {
    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

    @Test
    void shouldHaltAfterConsecutiveFailuresUntilReset() throws Exception {
        CycleGovernor governor = governor();
        governor.recordOutcome("default", false, false);
        governor.recordOutcome("default", false, false);
        assertTrue(governor.evaluate("default").continueRunning());

        governor.recordOutcome("default", false, false);
        CycleGovernor.GovernorDecision decision = governor.evaluate("default");

        assertTrue(decision.halted());
        assertEquals(1, governor.incidents().size());
        assertEquals(CycleGovernor.RootCauseCategory.FAILURE_STREAK_EXCEEDED, governor.incidents().get(0).rootCauseCategory());
        assertEquals(decision.incidentId(), governor.incidents().get(0).incidentId());
        assertTrue(governor.evaluate("other").continueRunning());

        governor.reset("default");
        assertTrue(governor.evaluate("default").continueRunning());
    }

    @Test
    void shouldClearStreakOnSuccess() throws Exception {
        CycleGovernor governor = governor();
        governor.recordOutcome("default", false, false);
        governor.recordOutcome("default", false, false);

        governor.recordOutcome("default", true, false);

        assertEquals(0, governor.state("default").consecutiveFailedCycles());
    }

    @Test
    void shouldHoldCooldownAfterSafetyAbort() throws Exception {
        CycleGovernor governor = governor();
        governor.recordOutcome("default", false, true);

        clock.advance(Duration.ofMinutes(59));
        CycleGovernor.GovernorDecision during = governor.evaluate("default");
        governor.reset("default");
        CycleGovernor.GovernorDecision afterReset = governor.evaluate("default");
        clock.advance(Duration.ofMinutes(1));
        CycleGovernor.GovernorDecision after = governor.evaluate("default");

        assertTrue(during.halted());
        assertTrue(afterReset.halted());
        assertFalse(after.halted());
        assertEquals(CycleGovernor.RootCauseCategory.SAFETY_COOLDOWN_ACTIVE, governor.incidents().get(0).rootCauseCategory());
    }

    @Test
    void shouldPersistStateAcrossInstances() throws Exception {
        governor().recordOutcome("default", false, false);

        assertEquals(1, governor().state("default").consecutiveFailedCycles());
    }

    private CycleGovernor governor() {
        return new CycleGovernor(new CycleGovernor.GovernorPolicy(3, Duration.ofMinutes(60)), tempDir.resolve("cycles"),
                tempDir.resolve("governor-incidents.jsonl"), clock);
    }
}
