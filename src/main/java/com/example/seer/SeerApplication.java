package com.example.seer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Seer - anomaly detection and approval-gated autonomous remediation.
 *
 * Architecture:
 * - Monitoring loop → baselines and 3σ anomaly detection over stored metrics
 * - Incident registry → validated lifecycle state machine with MTTR tracking
 * - Workflow orchestrator → human approval gate in front of the remediation pipeline
 * - Remediation pipeline → code search, fix generation, PR, notification, ticket
 * - Activity log and WebSocket gateway → audit trail and live dashboard events
 */
@SpringBootApplication
public class SeerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeerApplication.class, args);
    }
}
