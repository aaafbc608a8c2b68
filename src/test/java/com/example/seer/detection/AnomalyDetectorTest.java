package com.example.seer.detection;

import com.example.seer.config.SeerProperties;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.Baseline;
import com.example.seer.domain.Severity;
import com.example.seer.metrics.MetricStats;
import com.example.seer.metrics.MetricsRepository;
import com.example.seer.metrics.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MetricsRepository metricsRepository;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        SeerProperties properties = new SeerProperties();
        metricsRepository = mock(MetricsRepository.class);
        detector = new AnomalyDetector(metricsRepository, new BaselineCalculator(metricsRepository, properties), properties);
    }

    private void givenWindows(MetricStats baseline, MetricStats current) {
        when(metricsRepository.query(eq("api"), eq("p99_latency"), argThat(range -> spans(range, Duration.ofDays(7)))))
                .thenReturn(baseline);
        when(metricsRepository.query(eq("api"), eq("p99_latency"), argThat(range -> spans(range, Duration.ofHours(1)))))
                .thenReturn(current);
    }

    private static boolean spans(TimeRange range, Duration length) {
        return range != null && range.end().equals(NOW) && Duration.between(range.start(), range.end()).equals(length);
    }

    @Test
    void tenSigmaSpikeIsSevOneAnomaly() {
        givenWindows(new MetricStats(1000, 200, 320, 20), new MetricStats(60, 310, 400, 40));

        DetectionOutcome outcome = detector.detect("api", "p99_latency", "production", NOW);

        assertThat(outcome.isAnomaly()).isTrue();
        AnomalyResult anomaly = outcome.anomaly();
        assertThat(outcome.baseline().threshold()).isEqualTo(260.0);
        assertThat(anomaly.deviationSigma()).isEqualTo(10.0);
        assertThat(anomaly.severity()).isEqualTo(Severity.SEV_1);
        assertThat(anomaly.currentValue()).isEqualTo(400.0);
        assertThat(anomaly.expectedValue()).isEqualTo(200.0);
        assertThat(anomaly.currentAvg()).isEqualTo(310.0);
        assertThat(anomaly.detectedAt()).isEqualTo(NOW);
    }

    @Test
    void zeroVarianceBelowDegenerateThresholdIsNormal() {
        givenWindows(new MetricStats(500, 50, 50, 0), new MetricStats(60, 51, 54, 1));

        DetectionOutcome outcome = detector.detect("api", "p99_latency", "production", NOW);

        assertThat(outcome.kind()).isEqualTo(DetectionOutcome.Kind.NORMAL);
        assertThat(outcome.baseline().threshold()).isCloseTo(55.0, within(1e-9));
        assertThat(outcome.anomalyResult()).isEmpty();
    }

    @Test
    void zeroVarianceAboveDegenerateThresholdIsUnboundedAnomaly() {
        givenWindows(new MetricStats(500, 50, 50, 0), new MetricStats(60, 52, 60, 3));

        DetectionOutcome outcome = detector.detect("api", "p99_latency", "production", NOW);

        assertThat(outcome.isAnomaly()).isTrue();
        assertThat(outcome.anomaly().isUnbounded()).isTrue();
        assertThat(outcome.anomaly().severity()).isEqualTo(Severity.SEV_1);
    }

    @Test
    void emptyWindowIsInsufficientDataNotAnError() {
        givenWindows(new MetricStats(0, 0, 0, 0), new MetricStats(0, 0, 0, 0));

        DetectionOutcome outcome = detector.detect("api", "p99_latency", "production", NOW);

        assertThat(outcome.kind()).isEqualTo(DetectionOutcome.Kind.INSUFFICIENT_DATA);
    }

    @Test
    void emptyCurrentWindowIsInsufficientData() {
        givenWindows(new MetricStats(1000, 200, 320, 20), new MetricStats(0, 0, 0, 0));

        assertThat(detector.detect("api", "p99_latency", "production", NOW).kind())
                .isEqualTo(DetectionOutcome.Kind.INSUFFICIENT_DATA);
    }

    @Test
    void deviationJustBelowThreeSigmaIsNormal() {
        Baseline baseline = Baseline.of(100, 10, NOW);

        DetectionOutcome outcome = detector.evaluate("api", "p99_latency", "production", baseline,
                new MetricStats(10, 110, 129.9, 5), NOW);

        assertThat(outcome.kind()).isEqualTo(DetectionOutcome.Kind.NORMAL);
        assertThat(outcome.deviationSigma()).isLessThan(3.0);
    }

    @Test
    void dropsBelowTheMeanCountAsDeviationToo() {
        Baseline baseline = Baseline.of(100, 10, NOW);

        DetectionOutcome outcome = detector.evaluate("api", "throughput", "production", baseline,
                new MetricStats(10, 55, 60, 2), NOW);

        assertThat(outcome.isAnomaly()).isTrue();
        assertThat(outcome.anomaly().severity()).isEqualTo(Severity.SEV_2);
    }
}
