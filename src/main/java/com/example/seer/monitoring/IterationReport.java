package com.example.seer.monitoring;

import com.example.seer.domain.AnomalyResult;

import java.time.Instant;
import java.util.List;

/**
 * What one monitoring iteration saw and did.
 *
 * @param suppressed anomalies not acted on because their series is cooling down
 */
public record IterationReport(Instant checkedAt, int seriesChecked, int insufficientData,
                              List<AnomalyResult> anomalies, List<String> workflowsOpened,
                              int suppressed, int errors) {
}
