package com.example.seer.metrics;

/**
 * Aggregate statistics for one series over one time range.
 *
 * @param count  number of samples
 * @param mean   arithmetic mean
 * @param max    largest sample
 * @param stddev population standard deviation
 */
public record MetricStats(long count, double mean, double max, double stddev) {

    public boolean isEmpty() {
        return count == 0;
    }
}
