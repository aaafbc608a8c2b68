package com.example.seer.metrics;

import com.example.seer.domain.MetricDataPoint;
import com.example.seer.repository.MetricDataPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Write side of the metric store, fed by instrumentation and data loaders.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricIngestionService {

    private final MetricDataPointRepository dataPointRepository;
    private final Clock clock;

    public MetricDataPoint record(Instant timestamp, String metricName, double value, String service,
                                  String environment, String region, Map<String, String> tags) {
        Instant now = clock.instant();
        MetricDataPoint point = MetricDataPoint.create(
                timestamp != null ? timestamp : now, metricName, value, service, environment, region, tags, now);
        MetricDataPoint saved = dataPointRepository.save(point);
        log.debug("Recorded {}.{} = {} at {}", service, metricName, value, saved.getTimestamp());
        return saved;
    }
}
