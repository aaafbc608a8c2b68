package com.example.seer.detection;

import com.example.seer.config.SeerProperties;
import com.example.seer.domain.Baseline;
import com.example.seer.metrics.MetricStats;
import com.example.seer.metrics.MetricsRepository;
import com.example.seer.metrics.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Computes the rolling baseline of a series over the trailing window
 * (7 days by default).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BaselineCalculator {

    private final MetricsRepository metricsRepository;
    private final SeerProperties properties;

    public TimeRange baselineWindow(Instant now) {
        return TimeRange.trailing(now, Duration.ofDays(properties.getDetection().getBaselineWindowDays()));
    }

    public TimeRange currentWindow(Instant now) {
        return TimeRange.trailing(now, Duration.ofMinutes(properties.getDetection().getCurrentWindowMinutes()));
    }

    /**
     * Raw window statistics, for callers that also need the sample count.
     */
    public MetricStats baselineStats(String service, String metric, Instant now) {
        return metricsRepository.query(service, metric, baselineWindow(now));
    }

    /**
     * Baseline for the series, or empty when the window has no samples or
     * the series cannot form a valid (non-negative) baseline.
     */
    public Optional<Baseline> calculate(String service, String metric, Instant now) {
        return fromStats(service, metric, baselineStats(service, metric, now), now);
    }

    public Optional<Baseline> fromStats(String service, String metric, MetricStats stats, Instant now) {
        if (stats.isEmpty()) {
            log.debug("No baseline samples for {}/{}", service, metric);
            return Optional.empty();
        }
        if (stats.mean() < 0) {
            log.debug("Skipping {}/{}: negative mean {} cannot form a baseline", service, metric, stats.mean());
            return Optional.empty();
        }
        return Optional.of(Baseline.of(stats.mean(), stats.stddev(), now));
    }
}
