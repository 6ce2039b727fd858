package com.incidentlearn.stats;

public final class HypothesisTests {
    public static final String WELCH_T = "welch-t";
    public static final String TWO_PROPORTION_Z = "two-proportion-z";

    private HypothesisTests() {
    }

    public static TestResult welchTTest(SampleSummary control, SampleSummary treatment, double confidenceLevel) {
        if (control.count() < 2 || treatment.count() < 2) {
            throw new IllegalArgumentException("Welch t-test requires at least two samples per group");
        }
        double n1 = control.count();
        double n2 = treatment.count();
        double v1 = control.variance() / n1;
        double v2 = treatment.variance() / n2;
        double se = Math.sqrt(v1 + v2);
        double difference = treatment.mean() - control.mean();

        double df;
        double statistic;
        double pValue;
        if (se == 0.0) {
            df = n1 + n2 - 2;
            statistic = difference == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, difference);
            pValue = difference == 0.0 ? 1.0 : 0.0;
        } else {
            df = (v1 + v2) * (v1 + v2) / (v1 * v1 / (n1 - 1) + v2 * v2 / (n2 - 1));
            statistic = difference / se;
            pValue = Distributions.studentTTwoSidedPValue(statistic, df);
        }

        double pooledSd = Math.sqrt(((n1 - 1) * control.variance() + (n2 - 1) * treatment.variance()) / (n1 + n2 - 2));
        double effectSize = pooledSd == 0.0 ? 0.0 : difference / pooledSd;
        double margin = se == 0.0 ? 0.0 : Distributions.studentTQuantile(1 - (1 - confidenceLevel) / 2, df) * se;
        return new TestResult(
                WELCH_T,
                statistic,
                df,
                pValue,
                control.mean(),
                treatment.mean(),
                difference,
                relative(difference, control.mean()),
                se,
                effectSize,
                difference - margin,
                difference + margin);
    }

    /** Pooled standard error for the statistic, unpooled for the confidence interval. */
    public static TestResult twoProportionZTest(long controlSuccesses, long controlTrials, long treatmentSuccesses, long treatmentTrials,
            double confidenceLevel) {
        if (controlTrials <= 0 || treatmentTrials <= 0) {
            throw new IllegalArgumentException("two-proportion z-test requires trials in both groups");
        }
        if (controlSuccesses < 0 || controlSuccesses > controlTrials || treatmentSuccesses < 0 || treatmentSuccesses > treatmentTrials) {
            throw new IllegalArgumentException("successes must be within [0, trials]");
        }
        double p1 = (double) controlSuccesses / controlTrials;
        double p2 = (double) treatmentSuccesses / treatmentTrials;
        double pooled = (double) (controlSuccesses + treatmentSuccesses) / (controlTrials + treatmentTrials);
        double pooledSe = Math.sqrt(pooled * (1 - pooled) * (1.0 / controlTrials + 1.0 / treatmentTrials));
        double difference = p2 - p1;

        double statistic;
        double pValue;
        if (pooledSe == 0.0) {
            statistic = 0.0;
            pValue = 1.0;
        } else {
            statistic = difference / pooledSe;
            pValue = Distributions.normalTwoSidedPValue(statistic);
        }
        double unpooledSe = Math.sqrt(p1 * (1 - p1) / controlTrials + p2 * (1 - p2) / treatmentTrials);
        double margin = Distributions.normalQuantile(1 - (1 - confidenceLevel) / 2) * unpooledSe;
        double cohensH = 2 * Math.asin(Math.sqrt(p2)) - 2 * Math.asin(Math.sqrt(p1));
        return new TestResult(
                TWO_PROPORTION_Z,
                statistic,
                Double.POSITIVE_INFINITY,
                pValue,
                p1,
                p2,
                difference,
                relative(difference, p1),
                pooledSe,
                cohensH,
                difference - margin,
                difference + margin);
    }

    private static double relative(double difference, double baseline) {
        if (baseline == 0.0) {
            return difference == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, difference);
        }
        return difference / Math.abs(baseline);
    }
}
