package com.incidentlearn.experiment;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrafficAssignerTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldAssignSameSubjectToSameVariant() {
        ABTest test = test(ABTestState.RUNNING, 0.2);

        for (int i = 0; i < 50; i++) {
            assertEquals(TrafficAssigner.assign(test, "INC-" + i), TrafficAssigner.assign(test, "INC-" + i));
        }
    }

    @Test
    void shouldRouteRoughlyTheConfiguredShare() {
        ABTest test = test(ABTestState.RUNNING, 0.1);
        int treatment = 0;
        for (int i = 0; i < 5000; i++) {
            if (TrafficAssigner.assign(test, "INC-" + i) == Variant.TREATMENT) {
                treatment++;
            }
        }

        assertTrue(treatment > 400 && treatment < 600, "treatment share was " + treatment);
    }

    @Test
    void shouldSendEverythingToControlUnlessRunning() {
        for (ABTestState state : List.of(ABTestState.DRAFT, ABTestState.ANALYZING, ABTestState.CONCLUDED, ABTestState.ABORTED)) {
            ABTest test = test(state, 0.5);
            for (int i = 0; i < 100; i++) {
                assertEquals(Variant.CONTROL, TrafficAssigner.assign(test, "INC-" + i));
            }
        }
    }

    @Test
    void shouldBucketWithinUnitInterval() {
        double bucket = TrafficAssigner.bucket("ab-default-0001", "INC-1");

        assertTrue(bucket >= 0.0 && bucket < 1.0);
        assertEquals(bucket, TrafficAssigner.bucket("ab-default-0001", "INC-1"), 0.0);
        assertThrows(IllegalArgumentException.class, () -> TrafficAssigner.bucket("ab-default-0001", " "));
    }

    private static ABTest test(ABTestState state, double split) {
        return new ABTest("ab-default-0001", "default", 1L, 2L, split, List.of(), List.of(), 0.05, 100, 1, state, T0, T0, T0.plusSeconds(3600),
                null, null, null);
    }
}
