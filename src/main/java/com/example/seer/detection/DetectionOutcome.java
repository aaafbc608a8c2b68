package com.example.seer.detection;

import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.Baseline;

import java.util.Optional;

/**
 * Result of evaluating one series. Insufficient data is a normal outcome,
 * not an error.
 */
public record DetectionOutcome(Kind kind, String service, String metric, Baseline baseline,
                               double deviationSigma, AnomalyResult anomaly) {

    public enum Kind {
        INSUFFICIENT_DATA, NORMAL, ANOMALY
    }

    public static DetectionOutcome insufficientData(String service, String metric) {
        return new DetectionOutcome(Kind.INSUFFICIENT_DATA, service, metric, null, Double.NaN, null);
    }

    public static DetectionOutcome normal(String service, String metric, Baseline baseline, double deviationSigma) {
        return new DetectionOutcome(Kind.NORMAL, service, metric, baseline, deviationSigma, null);
    }

    public static DetectionOutcome anomaly(Baseline baseline, AnomalyResult anomaly) {
        return new DetectionOutcome(Kind.ANOMALY, anomaly.service(), anomaly.metric(), baseline,
                anomaly.deviationSigma(), anomaly);
    }

    public boolean isAnomaly() {
        return kind == Kind.ANOMALY;
    }

    public Optional<AnomalyResult> anomalyResult() {
        return Optional.ofNullable(anomaly);
    }
}
