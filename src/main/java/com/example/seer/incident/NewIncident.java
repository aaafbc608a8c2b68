package com.example.seer.incident;

import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.Severity;
import lombok.Builder;

/**
 * Everything needed to open an incident.
 *
 * @param source "monitoring" for detector-created incidents, "manual" for reported ones
 */
@Builder
public record NewIncident(
        String title,
        String service,
        Severity severity,
        String description,
        String environment,
        String affectedComponent,
        String source,
        AnomalyResult anomaly) {
}
