package com.incidentlearn.stats;

public final class LinearRegression {
    private LinearRegression() {
    }

    public static Fit fit(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have equal length");
        }
        int n = x.length;
        if (n < 3) {
            throw new IllegalArgumentException("regression requires at least three points");
        }
        double meanX = Descriptive.mean(x);
        double meanY = Descriptive.mean(y);
        double sxx = 0;
        double sxy = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            syy += dy * dy;
        }
        if (sxx == 0.0) {
            throw new IllegalArgumentException("regression requires variation in x");
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double sse = 0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (intercept + slope * x[i]);
            sse += residual * residual;
        }
        double residualVariance = sse / (n - 2);
        double slopeStdError = Math.sqrt(residualVariance / sxx);
        double t;
        double pValue;
        if (slopeStdError == 0.0) {
            t = slope == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, slope);
            pValue = slope == 0.0 ? 1.0 : 0.0;
        } else {
            t = slope / slopeStdError;
            pValue = Distributions.studentTTwoSidedPValue(t, n - 2);
        }
        double rSquared = syy == 0.0 ? 0.0 : 1.0 - sse / syy;
        return new Fit(slope, intercept, slopeStdError, t, pValue, rSquared, n);
    }

    public record Fit(
            double slope,
            double intercept,
            double slopeStdError,
            double tStatistic,
            double pValue,
            double rSquared,
            int n) {

        public double predict(double x) {
            return intercept + slope * x;
        }
    }
}
