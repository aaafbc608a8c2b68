package com.example.seer.metrics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatisticalUtilsTest {

    @Test
    void populationStatistics() {
        MetricStats stats = StatisticalUtils.calculateStats(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0));

        assertEquals(8, stats.count());
        assertEquals(5.0, stats.mean(), 1e-9);
        assertEquals(9.0, stats.max(), 1e-9);
        assertEquals(2.0, stats.stddev(), 1e-9);
    }

    @Test
    void constantSeriesHasZeroStddev() {
        MetricStats stats = StatisticalUtils.calculateStats(List.of(50.0, 50.0, 50.0));
        assertEquals(0.0, stats.stddev(), 0.0);
    }

    @Test
    void emptyInputYieldsEmptyStats() {
        assertTrue(StatisticalUtils.calculateStats(List.of()).isEmpty());
        assertTrue(StatisticalUtils.calculateStats(null).isEmpty());
    }
}
