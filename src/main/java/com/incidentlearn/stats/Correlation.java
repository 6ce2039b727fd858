package com.incidentlearn.stats;

public final class Correlation {
    private Correlation() {
    }

    public static Result pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("series must have equal length");
        }
        int n = x.length;
        if (n < 3) {
            return new Result(0.0, 1.0, n);
        }
        double meanX = Descriptive.mean(x);
        double meanY = Descriptive.mean(y);
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) {
            return new Result(0.0, 1.0, n);
        }
        double r = Math.max(-1.0, Math.min(1.0, sxy / Math.sqrt(sxx * syy)));
        if (Math.abs(r) >= 1.0) {
            return new Result(r, 0.0, n);
        }
        double t = r * Math.sqrt((n - 2) / (1 - r * r));
        return new Result(r, Distributions.studentTTwoSidedPValue(t, n - 2), n);
    }

    public record Result(double coefficient, double pValue, int n) {
    }
}
