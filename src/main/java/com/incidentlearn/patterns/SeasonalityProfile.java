package com.incidentlearn.patterns;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import com.incidentlearn.stats.Descriptive;

/** Hour-of-day, day-of-week and month-of-year distributions of event timestamps (UTC). */
public record SeasonalityProfile(double[] hourly, double[] weekly, double[] monthly) {
    public static final double SIGNIFICANT_VARIANCE = 0.01;

    public static SeasonalityProfile of(List<Instant> timestamps) {
        double[] hourly = new double[24];
        double[] weekly = new double[7];
        double[] monthly = new double[12];
        for (Instant timestamp : timestamps) {
            ZonedDateTime at = timestamp.atZone(ZoneOffset.UTC);
            hourly[at.getHour()]++;
            weekly[at.getDayOfWeek().getValue() - 1]++;
            monthly[at.getMonthValue() - 1]++;
        }
        normalize(hourly, timestamps.size());
        normalize(weekly, timestamps.size());
        normalize(monthly, timestamps.size());
        return new SeasonalityProfile(hourly, weekly, monthly);
    }

    public int peakHour() {
        return argMax(hourly);
    }

    /** 1 = Monday. */
    public int peakDayOfWeek() {
        return argMax(weekly) + 1;
    }

    public void addTo(Map<String, Double> statistics) {
        double hourlyVariance = Descriptive.variance(hourly);
        double weeklyVariance = Descriptive.variance(weekly);
        double monthlyVariance = Descriptive.variance(monthly);
        statistics.put("seasonality.hourly.variance", hourlyVariance);
        statistics.put("seasonality.weekly.variance", weeklyVariance);
        statistics.put("seasonality.monthly.variance", monthlyVariance);
        statistics.put("seasonality.hourly.significant", hourlyVariance > SIGNIFICANT_VARIANCE ? 1.0 : 0.0);
        statistics.put("seasonality.weekly.significant", weeklyVariance > SIGNIFICANT_VARIANCE ? 1.0 : 0.0);
        statistics.put("seasonality.monthly.significant", monthlyVariance > SIGNIFICANT_VARIANCE ? 1.0 : 0.0);
        statistics.put("seasonality.peakHour", (double) peakHour());
        statistics.put("seasonality.peakDayOfWeek", (double) peakDayOfWeek());
    }

    private static void normalize(double[] counts, int total) {
        if (total == 0) {
            return;
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] /= total;
        }
    }

    private static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
