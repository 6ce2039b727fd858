package com.incidentlearn.stats;

public final class PowerAnalysis {
    private PowerAnalysis() {
    }

    /**
     * Samples per variant needed to detect a standardized effect with a two-sided test:
     * n = 2 * ((z(1 - alpha/2) + z(power)) / effect)^2.
     */
    public static long requiredSamplesPerVariant(double alpha, double power, double standardizedEffect) {
        if (standardizedEffect <= 0.0) {
            throw new IllegalArgumentException("effect size must be > 0");
        }
        double zAlpha = Distributions.normalQuantile(1 - alpha / 2);
        double zBeta = Distributions.normalQuantile(power);
        double ratio = (zAlpha + zBeta) / standardizedEffect;
        return (long) Math.ceil(2 * ratio * ratio);
    }
}
