package com.example.seer.metrics;

/** One tracked time series: a metric reported by a service. */
public record SeriesKey(String service, String metric) {

    @Override
    public String toString() {
        return service + "/" + metric;
    }
}
