package com.example.seer.metrics;

import java.util.List;

/**
 * Read side of the time-series store. Detection only ever queries through
 * this interface.
 */
public interface MetricsRepository {

    /**
     * Aggregate statistics for one series. Returns stats with {@code count == 0}
     * when the range holds no samples.
     */
    MetricStats query(String service, String metric, TimeRange range);

    /**
     * Distinct series that reported at least one sample in the range.
     */
    List<SeriesKey> listSeries(TimeRange range, int limit);
}
