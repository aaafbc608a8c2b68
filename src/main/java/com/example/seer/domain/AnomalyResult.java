package com.example.seer.domain;

import com.example.seer.detection.SeverityScheme;
import com.example.seer.exception.ConsistencyViolationException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A metric observation that deviated at least 3σ from its baseline.
 *
 * <p>{@code deviationSigma} is {@link Double#POSITIVE_INFINITY} when the
 * baseline had zero variance and the observation crossed the degenerate
 * threshold.
 */
public record AnomalyResult(
        String metric,
        double currentValue,
        double expectedValue,
        double deviationSigma,
        Severity severity,
        Instant detectedAt,
        String service,
        String environment,
        double baselineStddev,
        double currentAvg) {

    public static final double MIN_SIGMA = 3.0;

    public AnomalyResult {
        if (metric == null || metric.isBlank()) {
            throw new ConsistencyViolationException("Anomaly requires a metric name");
        }
        if (detectedAt == null) {
            throw new ConsistencyViolationException("Anomaly requires detectedAt");
        }
        if (!(deviationSigma >= MIN_SIGMA)) {
            throw new ConsistencyViolationException(
                    "Deviation " + deviationSigma + "σ is below the anomaly threshold of " + MIN_SIGMA + "σ");
        }
        Severity expected = SeverityScheme.BANDED.classify(deviationSigma).orElseThrow();
        if (severity != expected) {
            throw new ConsistencyViolationException(
                    "Deviation " + deviationSigma + "σ requires " + expected.getLabel() + " but got " + severity);
        }
    }

    @JsonIgnore
    public boolean isUnbounded() {
        return Double.isInfinite(deviationSigma);
    }

    /** Key used for de-duplication across monitoring iterations. */
    @JsonIgnore
    public String seriesKey() {
        return service + "/" + metric;
    }
}
