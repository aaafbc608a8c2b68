package com.example.seer.incident;

import com.example.seer.detection.SeverityScheme;
import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Registers incidents reported by people rather than by the monitoring loop.
 *
 * <p>A report may carry the observed and expected value of a metric. With no
 * baseline at hand the deviation is estimated against a stddev of 10% of
 * the expected value; an estimate of 3σ or more is attached as the anomaly,
 * and when the reporter gave no severity the tiered scheme suggests one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualIncidentService {

    static final double ESTIMATED_STDDEV_RATIO = 0.1;

    private final IncidentRegistry incidentRegistry;
    private final Clock clock;

    public IncidentRecord report(ManualReport report) {
        Instant now = clock.instant();
        Optional<Double> sigma = estimateSigma(report.currentValue(), report.expectedValue());
        Severity severity = report.severity() != null
                ? report.severity()
                : sigma.flatMap(SeverityScheme.TIERED::classify).orElse(Severity.SEV_3);

        AnomalyResult anomaly = sigma
                .filter(s -> s >= AnomalyResult.MIN_SIGMA && report.metric() != null)
                .map(s -> new AnomalyResult(
                        report.metric(),
                        report.currentValue(),
                        report.expectedValue(),
                        s,
                        SeverityScheme.BANDED.classify(s).orElseThrow(),
                        now,
                        report.service(),
                        report.environment(),
                        report.expectedValue() * ESTIMATED_STDDEV_RATIO,
                        report.currentValue()))
                .orElse(null);

        log.info("Manual incident report for {}: {} ({})", report.service(), report.title(),
                sigma.map(s -> String.format("estimated %.1fσ", s)).orElse("no metric data"));
        return incidentRegistry.register(NewIncident.builder()
                .title(report.title())
                .service(report.service())
                .severity(severity)
                .description(report.description())
                .environment(report.environment())
                .affectedComponent(report.affectedComponent())
                .source("manual")
                .anomaly(anomaly)
                .build());
    }

    static Optional<Double> estimateSigma(Double current, Double expected) {
        if (current == null || expected == null || expected <= 0) {
            return Optional.empty();
        }
        return Optional.of(Math.abs(current - expected) / (expected * ESTIMATED_STDDEV_RATIO));
    }

    /**
     * An incident as reported through the API. Only title and service are required.
     */
    public record ManualReport(String title, String service, Severity severity, String description,
                               String environment, String affectedComponent, String metric,
                               Double currentValue, Double expectedValue) {

        public ManualReport {
            if (title == null || title.isBlank()) {
                throw new IllegalArgumentException("title is required");
            }
            if (service == null || service.isBlank()) {
                throw new IllegalArgumentException("service is required");
            }
        }
    }
}
