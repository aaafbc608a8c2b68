package com.example.seer.controller;

import com.example.seer.domain.Diagnosis;
import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.IncidentStatus;
import com.example.seer.domain.Remediation;
import com.example.seer.domain.Severity;
import com.example.seer.incident.IncidentRegistry;
import com.example.seer.incident.ManualIncidentService;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Incident Management REST API Controller.
 */
@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
public class IncidentController {

    private final IncidentRegistry incidentRegistry;
    private final ManualIncidentService manualIncidentService;
    private final Clock clock;

    @PostMapping("/register")
    public ResponseEntity<IncidentRecord> register(@RequestBody RegisterRequest request) {
        IncidentRecord incident = manualIncidentService.report(new ManualIncidentService.ManualReport(
                request.title(),
                request.service(),
                request.severity() != null ? Severity.fromLabel(request.severity()) : null,
                request.description(),
                request.environment() != null ? request.environment() : "production",
                request.affectedComponent(),
                request.metric(),
                request.currentValue(),
                request.expectedValue()));
        return ResponseEntity.status(HttpStatus.CREATED).body(incident);
    }

    /**
     * Most recent incidents first.
     */
    @GetMapping("/list")
    public ResponseEntity<List<IncidentRecord>> list(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(incidentRegistry.list(limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<IncidentRecord> get(@PathVariable String id) {
        return ResponseEntity.ok(incidentRegistry.get(id));
    }

    @PostMapping("/{id}/transition")
    public ResponseEntity<IncidentRecord> transition(@PathVariable String id, @RequestBody TransitionRequest request) {
        if (request.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        IncidentStatus target = IncidentStatus.valueOf(request.status().trim().toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(incidentRegistry.transition(id, target,
                request.actor() != null ? request.actor() : "user", request.note()));
    }

    /**
     * Close an incident under remediation. Omitted diagnosis or remediation
     * keep what the incident already records.
     */
    @PostMapping("/{id}/resolve")
    public ResponseEntity<IncidentRecord> resolve(@PathVariable String id, @RequestBody ResolveRequest request) {
        Diagnosis diagnosis = request.rootCause() != null
                ? new Diagnosis(request.rootCause(), request.affectedComponent(), request.impactExplanation(),
                        request.confidence() != null ? request.confidence() : 1.0)
                : null;
        Remediation remediation = request.filePath() != null
                ? new Remediation(request.filePath(), request.explanation(), request.prNumber(),
                        request.prUrl(), request.branch())
                : null;
        Instant resolvedAt = request.resolvedAt() != null ? request.resolvedAt() : clock.instant();
        return ResponseEntity.ok(incidentRegistry.resolve(id, diagnosis, remediation, resolvedAt));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RegisterRequest(String title, String service, String severity, String description,
                                  String environment, String affectedComponent, String metric,
                                  Double currentValue, Double expectedValue) {
    }

    public record TransitionRequest(String status, String note, String actor) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ResolveRequest(String rootCause, String affectedComponent, String impactExplanation,
                                 Double confidence, String filePath, String explanation, Integer prNumber,
                                 String prUrl, String branch, Instant resolvedAt) {
    }
}
