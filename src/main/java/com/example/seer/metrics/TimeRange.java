package com.example.seer.metrics;

import com.example.seer.exception.ConsistencyViolationException;

import java.time.Duration;
import java.time.Instant;

public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ConsistencyViolationException(
                    "Time range start " + start + " must be before end " + end);
        }
    }

    public static TimeRange trailing(Instant end, Duration length) {
        return new TimeRange(end.minus(length), end);
    }
}
