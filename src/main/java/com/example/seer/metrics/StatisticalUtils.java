package com.example.seer.metrics;

import java.util.List;

/**
 * Utility methods for the aggregate statistics used by baseline calculation.
 */
public final class StatisticalUtils {

    private StatisticalUtils() {}

    /**
     * Calculates count, mean, max and population standard deviation
     * (divide by n, not n-1) for a list of samples.
     *
     * @param values the samples, may be empty
     * @return stats with {@code count == 0} for an empty list
     */
    public static MetricStats calculateStats(List<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return new MetricStats(0, 0.0, 0.0, 0.0);
        }

        int n = values.size();
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        for (Number value : values) {
            double v = value.doubleValue();
            sum += v;
            max = Math.max(max, v);
        }
        double mean = sum / n;

        double sumSquaredDiffs = 0.0;
        for (Number value : values) {
            double diff = value.doubleValue() - mean;
            sumSquaredDiffs += diff * diff;
        }
        double stdDev = Math.sqrt(sumSquaredDiffs / n);

        return new MetricStats(n, mean, max, stdDev);
    }
}
