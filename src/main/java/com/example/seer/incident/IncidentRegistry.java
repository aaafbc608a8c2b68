package com.example.seer.incident;

import com.example.seer.activity.ActivityLogService;
import com.example.seer.domain.ActivityType;
import com.example.seer.domain.Diagnosis;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.IncidentStatus;
import com.example.seer.domain.Remediation;
import com.example.seer.exception.IncidentNotFoundException;
import com.example.seer.exception.InvalidTransitionException;
import com.example.seer.gateway.EventBroadcaster;
import com.example.seer.repository.IncidentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the incident lifecycle:
 * DETECTED → ANALYZING → AWAITING_APPROVAL → REMEDIATING → RESOLVED.
 *
 * <p>Every mutation of a given incident runs under that incident's lock, and
 * the entity's version column rejects writes from a stale copy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentRegistry {

    private final IncidentRecordRepository incidentRepository;
    private final IncidentIdAllocator idAllocator;
    private final KeyedLocks locks;
    private final ActivityLogService activityLog;
    private final EventBroadcaster events;
    private final Clock clock;

    /**
     * Open a new incident in DETECTED with a placeholder diagnosis.
     */
    public IncidentRecord register(NewIncident request) {
        Instant now = clock.instant();
        String id = idAllocator.allocate();
        String affected = request.affectedComponent() != null ? request.affectedComponent() : request.service();

        IncidentRecord incident = IncidentRecord.builder()
                .id(id)
                .title(request.title())
                .service(request.service())
                .environment(request.environment())
                .description(request.description())
                .severity(request.severity())
                .status(IncidentStatus.DETECTED)
                .source(request.source() != null ? request.source() : "manual")
                .anomaly(request.anomaly())
                .diagnosis(Diagnosis.placeholder(affected, request.description()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        incident.addTimelineEntry(now, "DETECTED", "Incident registered by " + incident.getSource());
        incident = incidentRepository.save(incident);

        log.info("Registered incident {} [{}] for service {}: {}",
                id, request.severity().getLabel(), request.service(), request.title());
        activityLog.record(ActivityType.INCIDENT_REGISTERED, incident.getSource(),
                "Incident " + id + " registered: " + request.title(),
                Map.of("incident_id", id,
                        "service", request.service(),
                        "severity", request.severity().getLabel()));
        events.broadcast("incident.created", Map.of(
                "incident_id", id,
                "title", request.title(),
                "severity", request.severity().getLabel(),
                "service", request.service()));
        return incident;
    }

    /**
     * Apply one state-machine edge.
     *
     * @throws com.example.seer.exception.ConsistencyViolationException when moving to RESOLVED
     *         without the resolution fields; use {@link #resolve} for that
     * @throws InvalidTransitionException when the edge is not permitted
     */
    public IncidentRecord transition(String id, IncidentStatus target, String actor, String note) {
        return locks.withLock(id, () -> {
            IncidentRecord incident = get(id);
            if (target == IncidentStatus.RESOLVED) {
                IncidentRecord.validateResolution(id, incident.getCreatedAt(), incident.getResolvedAt(),
                        incident.getMttrSeconds(), incident.getDiagnosis(), incident.getRemediation());
            }
            return apply(incident, target, actor, note);
        });
    }

    /**
     * Close a REMEDIATING incident. A null diagnosis or remediation keeps the
     * one already on the record.
     */
    public IncidentRecord resolve(String id, Diagnosis diagnosis, Remediation remediation, Instant resolvedAt) {
        return locks.withLock(id, () -> {
            IncidentRecord incident = get(id);
            if (!incident.getStatus().canTransitionTo(IncidentStatus.RESOLVED)) {
                throw new InvalidTransitionException(id, incident.getStatus(), IncidentStatus.RESOLVED);
            }
            Diagnosis finalDiagnosis = diagnosis != null ? diagnosis : incident.getDiagnosis();
            Remediation finalRemediation = remediation != null ? remediation : incident.getRemediation();
            double mttr = Duration.between(incident.getCreatedAt(), resolvedAt).toMillis() / 1000.0;
            IncidentRecord.validateResolution(id, incident.getCreatedAt(), resolvedAt, mttr,
                    finalDiagnosis, finalRemediation);

            incident.setDiagnosis(finalDiagnosis);
            incident.setRemediation(finalRemediation);
            incident.setResolvedAt(resolvedAt);
            incident.setMttrSeconds(mttr);
            return apply(incident, IncidentStatus.RESOLVED, "system",
                    String.format("Resolved after %.0fs", mttr));
        });
    }

    /**
     * Record the fix that was shipped for an incident still under remediation.
     */
    public IncidentRecord attachRemediation(String id, Remediation remediation) {
        return locks.withLock(id, () -> {
            IncidentRecord incident = get(id);
            if (incident.getStatus() != IncidentStatus.REMEDIATING) {
                throw new InvalidTransitionException(id, incident.getStatus(), IncidentStatus.REMEDIATING);
            }
            Instant now = clock.instant();
            incident.setRemediation(remediation);
            incident.setUpdatedAt(now);
            incident.addTimelineEntry(now, "REMEDIATION_ATTACHED",
                    remediation.prUrl() != null ? "PR " + remediation.prUrl() : remediation.filePath());
            return incidentRepository.save(incident);
        });
    }

    public IncidentRecord get(String id) {
        return incidentRepository.findById(id).orElseThrow(() -> new IncidentNotFoundException(id));
    }

    /** Most recent incidents first. */
    public List<IncidentRecord> list(int limit) {
        return incidentRepository.findRecent(PageRequest.of(0, Math.max(1, limit)));
    }

    private IncidentRecord apply(IncidentRecord incident, IncidentStatus target, String actor, String note) {
        IncidentStatus from = incident.getStatus();
        if (!from.canTransitionTo(target)) {
            throw new InvalidTransitionException(incident.getId(), from, target);
        }
        Instant now = clock.instant();
        incident.setStatus(target);
        incident.setUpdatedAt(now);
        incident.addTimelineEntry(now, target.name(), note);
        incident.validate();
        IncidentRecord saved = incidentRepository.save(incident);

        log.info("Incident {} {} -> {}{}", incident.getId(), from, target, note != null ? " (" + note + ")" : "");
        Map<String, Object> details = new HashMap<>();
        details.put("incident_id", incident.getId());
        details.put("from", from.name());
        details.put("to", target.name());
        if (note != null) details.put("note", note);
        if (saved.getMttrSeconds() != null) details.put("mttr_seconds", saved.getMttrSeconds());
        activityLog.record(ActivityType.INCIDENT_TRANSITION, actor,
                "Incident " + incident.getId() + " moved to " + target, details);
        events.broadcast("incident.transitioned", details);
        return saved;
    }
}
