package com.incidentlearn.stats;

public final class Distributions {
    private static final double[] LANCZOS = {
            76.18009172947146,
            -86.50532032941677,
            24.01409824083091,
            -1.231739572450155,
            0.1208650973866179e-2,
            -0.5395239384953e-5
    };

    private static final double[] ACKLAM_A = {
            -3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
            1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00
    };
    private static final double[] ACKLAM_B = {
            -5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
            6.680131188771972e+01, -1.328068155288572e+01
    };
    private static final double[] ACKLAM_C = {
            -7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
            -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00
    };
    private static final double[] ACKLAM_D = {
            7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
            3.754408661907416e+00
    };

    private Distributions() {
    }

    public static double normalCdf(double x) {
        return 0.5 * erfc(-x / Math.sqrt(2.0));
    }

    /** Two-sided p-value of a standard normal statistic. */
    public static double normalTwoSidedPValue(double z) {
        if (Double.isInfinite(z)) {
            return 0.0;
        }
        return Math.min(1.0, erfc(Math.abs(z) / Math.sqrt(2.0)));
    }

    public static double normalQuantile(double p) {
        if (p <= 0.0 || p >= 1.0) {
            throw new IllegalArgumentException("probability must be in (0, 1): " + p);
        }
        double low = 0.02425;
        double high = 1 - low;
        if (p < low) {
            double q = Math.sqrt(-2 * Math.log(p));
            return (((((ACKLAM_C[0] * q + ACKLAM_C[1]) * q + ACKLAM_C[2]) * q + ACKLAM_C[3]) * q + ACKLAM_C[4]) * q + ACKLAM_C[5])
                    / ((((ACKLAM_D[0] * q + ACKLAM_D[1]) * q + ACKLAM_D[2]) * q + ACKLAM_D[3]) * q + 1);
        }
        if (p > high) {
            double q = Math.sqrt(-2 * Math.log(1 - p));
            return -(((((ACKLAM_C[0] * q + ACKLAM_C[1]) * q + ACKLAM_C[2]) * q + ACKLAM_C[3]) * q + ACKLAM_C[4]) * q + ACKLAM_C[5])
                    / ((((ACKLAM_D[0] * q + ACKLAM_D[1]) * q + ACKLAM_D[2]) * q + ACKLAM_D[3]) * q + 1);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((ACKLAM_A[0] * r + ACKLAM_A[1]) * r + ACKLAM_A[2]) * r + ACKLAM_A[3]) * r + ACKLAM_A[4]) * r + ACKLAM_A[5]) * q
                / (((((ACKLAM_B[0] * r + ACKLAM_B[1]) * r + ACKLAM_B[2]) * r + ACKLAM_B[3]) * r + ACKLAM_B[4]) * r + 1);
    }

    public static double studentTCdf(double t, double degreesOfFreedom) {
        if (degreesOfFreedom <= 0) {
            throw new IllegalArgumentException("degrees of freedom must be > 0");
        }
        if (Double.isInfinite(t)) {
            return t > 0 ? 1.0 : 0.0;
        }
        double x = degreesOfFreedom / (degreesOfFreedom + t * t);
        double tail = 0.5 * regularizedIncompleteBeta(x, degreesOfFreedom / 2.0, 0.5);
        return t > 0 ? 1.0 - tail : tail;
    }

    public static double studentTTwoSidedPValue(double t, double degreesOfFreedom) {
        if (Double.isInfinite(t)) {
            return 0.0;
        }
        double x = degreesOfFreedom / (degreesOfFreedom + t * t);
        return Math.min(1.0, regularizedIncompleteBeta(x, degreesOfFreedom / 2.0, 0.5));
    }

    public static double studentTQuantile(double p, double degreesOfFreedom) {
        if (p <= 0.0 || p >= 1.0) {
            throw new IllegalArgumentException("probability must be in (0, 1): " + p);
        }
        if (degreesOfFreedom > 1e6) {
            return normalQuantile(p);
        }
        double lo = -1e4;
        double hi = 1e4;
        for (int i = 0; i < 200; i++) {
            double mid = (lo + hi) / 2.0;
            if (studentTCdf(mid, degreesOfFreedom) < p) {
                lo = mid;
            } else {
                hi = mid;
            }
            if (hi - lo < 1e-10) {
                break;
            }
        }
        return (lo + hi) / 2.0;
    }

    public static double logGamma(double x) {
        double y = x;
        double tmp = x + 5.5;
        tmp -= (x + 0.5) * Math.log(tmp);
        double ser = 1.000000000190015;
        for (double coefficient : LANCZOS) {
            y += 1;
            ser += coefficient / y;
        }
        return -tmp + Math.log(2.5066282746310005 * ser / x);
    }

    public static double regularizedIncompleteBeta(double x, double a, double b) {
        if (x <= 0.0) {
            return 0.0;
        }
        if (x >= 1.0) {
            return 1.0;
        }
        double front = Math.exp(logGamma(a + b) - logGamma(a) - logGamma(b) + a * Math.log(x) + b * Math.log(1 - x));
        if (x < (a + 1) / (a + b + 2)) {
            return front * betaContinuedFraction(x, a, b) / a;
        }
        return 1.0 - front * betaContinuedFraction(1 - x, b, a) / b;
    }

    private static double betaContinuedFraction(double x, double a, double b) {
        double tiny = 1e-300;
        double qab = a + b;
        double qap = a + 1;
        double qam = a - 1;
        double c = 1.0;
        double d = 1.0 - qab * x / qap;
        if (Math.abs(d) < tiny) {
            d = tiny;
        }
        d = 1.0 / d;
        double h = d;
        for (int m = 1; m <= 300; m++) {
            int m2 = 2 * m;
            double aa = m * (b - m) * x / ((qam + m2) * (a + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < tiny) {
                d = tiny;
            }
            c = 1.0 + aa / c;
            if (Math.abs(c) < tiny) {
                c = tiny;
            }
            d = 1.0 / d;
            h *= d * c;
            aa = -(a + m) * (qab + m) * x / ((a + m2) * (qap + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < tiny) {
                d = tiny;
            }
            c = 1.0 + aa / c;
            if (Math.abs(c) < tiny) {
                c = tiny;
            }
            d = 1.0 / d;
            double del = d * c;
            h *= del;
            if (Math.abs(del - 1.0) < 3e-14) {
                break;
            }
        }
        return h;
    }

    // Chebyshev approximation, fractional error below 1.2e-7.
    static double erfc(double x) {
        double z = Math.abs(x);
        double t = 1.0 / (1.0 + 0.5 * z);
        double ans = t * Math.exp(-z * z - 1.26551223 + t * (1.00002368 + t * (0.37409196 + t * (0.09678418
                + t * (-0.18628806 + t * (0.27886807 + t * (-1.13520398 + t * (1.48851587
                + t * (-0.82215223 + t * 0.17087277)))))))));
        return x >= 0 ? ans : 2.0 - ans;
    }
}
