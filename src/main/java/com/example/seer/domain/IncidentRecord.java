package com.example.seer.domain;

import com.example.seer.domain.converter.AnomalyResultConverter;
import com.example.seer.domain.converter.DiagnosisConverter;
import com.example.seer.domain.converter.RemediationConverter;
import com.example.seer.domain.converter.TimelineConverter;
import com.example.seer.exception.ConsistencyViolationException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit record of one production incident. Never deleted; mutated only
 * through {@link com.example.seer.incident.IncidentRegistry}.
 */
@Entity
@Table(name = "incidents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentRecord {

    /** Allowed drift between the stored MTTR and resolvedAt - createdAt. */
    public static final double MTTR_TOLERANCE_SECONDS = 1.0;

    @Id
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private String service;

    private String environment;

    @Column(length = 4096)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentStatus status;

    /** "monitoring" for detector-created incidents, "manual" for reported ones */
    @Column(nullable = false)
    private String source;

    @Convert(converter = AnomalyResultConverter.class)
    @Column(length = 4096)
    private AnomalyResult anomaly;

    @Convert(converter = DiagnosisConverter.class)
    @Column(length = 4096)
    private Diagnosis diagnosis;

    @Convert(converter = RemediationConverter.class)
    @Column(length = 4096)
    private Remediation remediation;

    @Convert(converter = TimelineConverter.class)
    @Column(length = 32768)
    @Builder.Default
    private List<TimelineEntry> timeline = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "mttr_seconds")
    private Double mttrSeconds;

    @Version
    private Long version;

    /**
     * Appends a timeline event. The list is replaced rather than mutated so the
     * converted column is always marked dirty.
     */
    public void addTimelineEntry(Instant at, String event, String detail) {
        List<TimelineEntry> updated = new ArrayList<>(timeline != null ? timeline : List.of());
        updated.add(new TimelineEntry(at, event, detail));
        this.timeline = updated;
    }

    /**
     * Checks the resolution invariant for the current status.
     *
     * @throws ConsistencyViolationException when a RESOLVED record lacks its resolution fields
     */
    public void validate() {
        if (status != IncidentStatus.RESOLVED) return;
        validateResolution(id, createdAt, resolvedAt, mttrSeconds, diagnosis, remediation);
    }

    /**
     * Checks that a record carrying these fields may be RESOLVED.
     *
     * @throws ConsistencyViolationException when any resolution field is missing or the MTTR is off
     */
    public static void validateResolution(String id, Instant createdAt, Instant resolvedAt, Double mttrSeconds,
                                          Diagnosis diagnosis, Remediation remediation) {
        if (resolvedAt == null) {
            throw new ConsistencyViolationException("RESOLVED status requires resolvedAt for " + id);
        }
        if (mttrSeconds == null) {
            throw new ConsistencyViolationException("RESOLVED status requires mttr for " + id);
        }
        if (mttrSeconds < 0) {
            throw new ConsistencyViolationException("MTTR must be non-negative, got " + mttrSeconds);
        }
        double expected = Duration.between(createdAt, resolvedAt).toMillis() / 1000.0;
        if (Math.abs(mttrSeconds - expected) > MTTR_TOLERANCE_SECONDS) {
            throw new ConsistencyViolationException(String.format(
                    "MTTR %.1fs doesn't match time difference %.1fs for %s", mttrSeconds, expected, id));
        }
        if (diagnosis == null) {
            throw new ConsistencyViolationException("RESOLVED incidents require a diagnosis: " + id);
        }
        if (remediation == null) {
            throw new ConsistencyViolationException("RESOLVED incidents require a remediation: " + id);
        }
    }

    @PrePersist
    @PreUpdate
    protected void beforeSave() {
        validate();
    }
}
