package com.example.seer.domain;

import com.example.seer.domain.converter.ObjectMapConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable audit trail entry: one per incident transition and per pipeline
 * step outcome.
 */
@Entity
@Table(name = "activity_log", indexes = {
        @Index(name = "idx_activity_type", columnList = "type"),
        @Index(name = "idx_activity_timestamp", columnList = "occurred_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActivityLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ActivityType type;

    /** Who performed the action: "system", "monitoring", "pipeline", or the approving user */
    @Column(name = "actor", nullable = false, updatable = false)
    private String user;

    @Column(nullable = false, length = 1024, updatable = false)
    private String summary;

    @Convert(converter = ObjectMapConverter.class)
    @Column(length = 8192, updatable = false)
    private Map<String, Object> details;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Outcome status;

    public enum Outcome {
        SUCCESS, FAILED, PENDING, SKIPPED
    }
}
