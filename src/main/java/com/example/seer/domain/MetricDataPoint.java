package com.example.seer.domain;

import com.example.seer.domain.converter.StringMapConverter;
import com.example.seer.exception.ConsistencyViolationException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * A single metric observation. Rows are append-only: every column is
 * non-updatable and there are no setters.
 */
@Entity
@Table(name = "metric_data_points", indexes = {
        @Index(name = "idx_metric_ts", columnList = "observed_at"),
        @Index(name = "idx_metric_series", columnList = "service, metric_name")
})
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MetricDataPoint {

    public static final Duration MAX_AGE = Duration.ofDays(30);

    private static final Set<String> NON_NEGATIVE_METRICS =
            Set.of("p99_latency", "p95_latency", "throughput", "request_count");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "observed_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "metric_name", nullable = false, updatable = false)
    private String metricName;

    @Column(name = "metric_value", nullable = false, updatable = false)
    private double value;

    @Column(nullable = false, updatable = false)
    private String service;

    @Column(updatable = false)
    private String environment;

    @Column(updatable = false)
    private String region;

    @Convert(converter = StringMapConverter.class)
    @Column(length = 2048, updatable = false)
    private Map<String, String> tags;

    /**
     * Validating factory. {@code now} bounds the accepted timestamp window.
     */
    public static MetricDataPoint create(Instant timestamp, String metricName, double value, String service,
                                         String environment, String region, Map<String, String> tags,
                                         Instant now) {
        if (timestamp == null) {
            throw new ConsistencyViolationException("Metric timestamp is required");
        }
        if (metricName == null || metricName.isBlank() || service == null || service.isBlank()) {
            throw new ConsistencyViolationException("Metric name and service are required");
        }
        if (timestamp.isBefore(now.minus(MAX_AGE))) {
            throw new ConsistencyViolationException("Timestamp must be within last 30 days, got " + timestamp);
        }
        if (timestamp.isAfter(now)) {
            throw new ConsistencyViolationException("Timestamp cannot be in the future, got " + timestamp);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ConsistencyViolationException(metricName + " must be a finite number");
        }
        if (value < 0 && requiresNonNegative(metricName)) {
            throw new ConsistencyViolationException(metricName + " must be non-negative, got " + value);
        }
        return MetricDataPoint.builder()
                .timestamp(timestamp)
                .metricName(metricName)
                .value(value)
                .service(service)
                .environment(environment)
                .region(region)
                .tags(tags != null ? Map.copyOf(tags) : Map.of())
                .build();
    }

    /** Latency and throughput-class metrics can never go below zero. */
    public static boolean requiresNonNegative(String metricName) {
        return NON_NEGATIVE_METRICS.contains(metricName)
                || metricName.endsWith("_latency")
                || metricName.endsWith("_ms");
    }
}
