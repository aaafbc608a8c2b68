package com.example.seer.controller;

import com.example.seer.domain.MetricDataPoint;
import com.example.seer.metrics.MetricIngestionService;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

/**
 * Ingests metric samples into the time-series store.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricIngestionService ingestionService;

    @PostMapping
    public ResponseEntity<MetricDataPoint> record(@RequestBody MetricPointRequest request) {
        if (request.metricName() == null || request.service() == null || request.value() == null) {
            throw new IllegalArgumentException("metric_name, service and value are required");
        }
        MetricDataPoint point = ingestionService.record(
                request.timestamp(),
                request.metricName(),
                request.value(),
                request.service(),
                request.environment() != null ? request.environment() : "production",
                request.region(),
                request.tags());
        return ResponseEntity.status(HttpStatus.CREATED).body(point);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MetricPointRequest(Instant timestamp, String metricName, Double value, String service,
                                     String environment, String region, Map<String, String> tags) {
    }
}
