package com.example.seer.repository;

import com.example.seer.domain.MetricDataPoint;
import com.example.seer.metrics.SeriesKey;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface MetricDataPointRepository extends JpaRepository<MetricDataPoint, String> {

    @Query("SELECT m.value FROM MetricDataPoint m WHERE m.service = :service AND m.metricName = :metric " +
           "AND m.timestamp >= :start AND m.timestamp <= :end")
    List<Double> findValues(String service, String metric, Instant start, Instant end);

    @Query("SELECT DISTINCT new com.example.seer.metrics.SeriesKey(m.service, m.metricName) " +
           "FROM MetricDataPoint m WHERE m.timestamp >= :start AND m.timestamp <= :end " +
           "ORDER BY m.service, m.metricName")
    List<SeriesKey> findSeries(Instant start, Instant end, Pageable pageable);
}
