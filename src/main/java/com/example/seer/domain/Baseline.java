package com.example.seer.domain;

import com.example.seer.exception.ConsistencyViolationException;

import java.time.Instant;

/**
 * Rolling statistical summary of one service/metric pair.
 *
 * <p>{@code threshold} is {@code mean + 3 * stddev}; when the window has no
 * variance it falls back to {@code mean * 1.1} so the detection band never has
 * zero width.
 */
public record Baseline(double mean, double stddev, double threshold, Instant calculatedAt) {

    public static final double SIGMA_MULTIPLIER = 3.0;
    public static final double DEGENERATE_FACTOR = 1.1;
    private static final double TOLERANCE = 0.01;

    public Baseline {
        if (calculatedAt == null) {
            throw new ConsistencyViolationException("Baseline requires calculatedAt");
        }
        if (!(mean >= 0) || !(stddev >= 0) || !(threshold >= 0)) {
            throw new ConsistencyViolationException(String.format(
                    "Baseline values must be non-negative (mean=%s, stddev=%s, threshold=%s)",
                    mean, stddev, threshold));
        }
        double expected = expectedThreshold(mean, stddev);
        if (Math.abs(threshold - expected) > TOLERANCE) {
            throw new ConsistencyViolationException(String.format(
                    "Baseline threshold %s does not match expected %s", threshold, expected));
        }
    }

    public static Baseline of(double mean, double stddev, Instant calculatedAt) {
        return new Baseline(mean, stddev, expectedThreshold(mean, stddev), calculatedAt);
    }

    public static double expectedThreshold(double mean, double stddev) {
        return stddev == 0 ? mean * DEGENERATE_FACTOR : mean + SIGMA_MULTIPLIER * stddev;
    }

    public boolean isDegenerate() {
        return stddev == 0;
    }
}
