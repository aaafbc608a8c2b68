package com.example.seer.detection;

import com.example.seer.config.SeerProperties;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.Baseline;
import com.example.seer.domain.Severity;
import com.example.seer.metrics.MetricStats;
import com.example.seer.metrics.MetricsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Anomaly Detector - compares the maximum of the current window (last hour)
 * against the series baseline and reports deviations of 3σ or more.
 *
 * <p>Pure computation over fetched data: persisting the anomaly is up to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private final MetricsRepository metricsRepository;
    private final BaselineCalculator baselineCalculator;
    private final SeerProperties properties;

    /**
     * Evaluate one series at {@code now}.
     */
    public DetectionOutcome detect(String service, String metric, String environment, Instant now) {
        MetricStats baselineStats = baselineCalculator.baselineStats(service, metric, now);
        MetricStats current = metricsRepository.query(service, metric, baselineCalculator.currentWindow(now));
        Optional<Baseline> baseline = baselineCalculator.fromStats(service, metric, baselineStats, now);
        if (baseline.isEmpty() || current.isEmpty()) {
            return DetectionOutcome.insufficientData(service, metric);
        }
        return evaluate(service, metric, environment, baseline.get(), current, now);
    }

    /**
     * Compare a current aggregate against an already computed baseline.
     */
    public DetectionOutcome evaluate(String service, String metric, String environment,
                                     Baseline baseline, MetricStats current, Instant now) {
        if (current.isEmpty()) {
            return DetectionOutcome.insufficientData(service, metric);
        }

        double deviation = deviationSigma(baseline, current.max());
        double minSigma = Math.max(AnomalyResult.MIN_SIGMA, properties.getDetection().getSigmaThreshold());
        if (!(deviation >= minSigma)) {
            return DetectionOutcome.normal(service, metric, baseline, deviation);
        }

        Severity severity = SeverityScheme.BANDED.classify(deviation).orElseThrow();
        AnomalyResult anomaly = new AnomalyResult(
                metric,
                current.max(),
                baseline.mean(),
                deviation,
                severity,
                now,
                service,
                environment,
                baseline.stddev(),
                current.mean());

        if (anomaly.isUnbounded()) {
            log.warn("ANOMALY DETECTED: {}.{} = {} exceeds zero-variance threshold {} (baseline {})",
                    service, metric, String.format("%.2f", current.max()),
                    String.format("%.2f", baseline.threshold()), String.format("%.2f", baseline.mean()));
        } else {
            log.warn("ANOMALY DETECTED: {}.{} = {} (baseline: {} ± {}, {}σ deviation, {})",
                    service, metric, String.format("%.2f", current.max()),
                    String.format("%.2f", baseline.mean()), String.format("%.2f", baseline.stddev()),
                    String.format("%.1f", deviation), severity.getLabel());
        }
        return DetectionOutcome.anomaly(baseline, anomaly);
    }

    /**
     * Deviation of {@code observed} from the baseline in sigmas. A zero-variance
     * baseline has no sigma unit: crossing its degenerate threshold is reported
     * as an unbounded deviation, anything else as zero.
     */
    public static double deviationSigma(Baseline baseline, double observed) {
        if (baseline.isDegenerate()) {
            return observed > baseline.threshold() ? Double.POSITIVE_INFINITY : 0.0;
        }
        return Math.abs(observed - baseline.mean()) / baseline.stddev();
    }
}
