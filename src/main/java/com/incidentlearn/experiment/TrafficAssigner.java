package com.incidentlearn.experiment;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Deterministic subject-to-variant assignment. Only running tests route anything to the treatment. */
public final class TrafficAssigner {
    private TrafficAssigner() {
    }

    public static Variant assign(ABTest test, String subjectId) {
        if (test.state() != ABTestState.RUNNING) {
            return Variant.CONTROL;
        }
        return bucket(test.id(), subjectId) < test.trafficSplit() ? Variant.TREATMENT : Variant.CONTROL;
    }

    /** Uniform position in [0, 1) derived from SHA-256 of {@code testId:subjectId}. */
    public static double bucket(String testId, String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subject id is required for assignment");
        }
        byte[] digest = sha256(testId + ":" + subjectId);
        long bits = ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        return (bits >>> 11) * 0x1.0p-53;
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
