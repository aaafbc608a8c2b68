package com.example.seer.domain;

import java.time.Instant;

public record TimelineEntry(Instant timestamp, String event, String detail) {
}
