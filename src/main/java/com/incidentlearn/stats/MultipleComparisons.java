package com.incidentlearn.stats;

public final class MultipleComparisons {
    private MultipleComparisons() {
    }

    /** Per-comparison significance threshold under Bonferroni correction. */
    public static double bonferroni(double familyAlpha, int comparisons) {
        if (familyAlpha <= 0.0 || familyAlpha >= 1.0) {
            throw new IllegalArgumentException("alpha must be in (0, 1): " + familyAlpha);
        }
        if (comparisons <= 0) {
            throw new IllegalArgumentException("comparisons must be > 0");
        }
        return familyAlpha / comparisons;
    }
}
