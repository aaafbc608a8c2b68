package com.example.seer.monitoring;

import com.example.seer.domain.AnomalyResult;
import com.example.seer.domain.PendingWorkflow;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonitoringStatus(boolean running, Instant lastCheck, int checkIntervalSeconds,
                               double anomalyThresholdSigma, List<AnomalyResult> recentAnomalies,
                               List<PendingWorkflow> pendingWorkflows) {
}
