package com.example.seer.metrics;

import com.example.seer.repository.MetricDataPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Default {@link MetricsRepository} over the local metric_data_points table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMetricsRepository implements MetricsRepository {

    private final MetricDataPointRepository dataPointRepository;

    @Override
    @Transactional(readOnly = true)
    public MetricStats query(String service, String metric, TimeRange range) {
        List<Double> values = dataPointRepository.findValues(service, metric, range.start(), range.end());
        MetricStats stats = StatisticalUtils.calculateStats(values);
        log.debug("Stats for {}/{} over [{}, {}]: {}", service, metric, range.start(), range.end(), stats);
        return stats;
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeriesKey> listSeries(TimeRange range, int limit) {
        return dataPointRepository.findSeries(range.start(), range.end(), PageRequest.of(0, Math.max(1, limit)));
    }
}
