package com.example.seer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the Seer engine.
 * Maps to the 'seer' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "seer")
public class SeerProperties {

    private MonitoringConfig monitoring = new MonitoringConfig();
    private DetectionConfig detection = new DetectionConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private CollaboratorsConfig collaborators = new CollaboratorsConfig();

    @Data
    public static class MonitoringConfig {
        private boolean autoStart = false;
        private int checkIntervalSeconds = 60;
        /** Minimum time between two workflows opened for the same service/metric */
        private int cooldownMinutes = 30;
        private int recentAnomalyLimit = 10;
        private String environment = "production";
    }

    @Data
    public static class DetectionConfig {
        private int baselineWindowDays = 7;
        private int currentWindowMinutes = 60;
        private double sigmaThreshold = 3.0;
        private int maxTrackedSeries = 100;
    }

    @Data
    public static class PipelineConfig {
        private boolean ticketStepEnabled = false;
        private int codeSearchLimit = 5;
        private long codeSearchTimeoutSeconds = 30;
        private long fixGenerationTimeoutSeconds = 60;
        private long pullRequestTimeoutSeconds = 30;
        private long notificationTimeoutSeconds = 15;
        private long ticketTimeoutSeconds = 30;
    }

    @Data
    public static class CollaboratorsConfig {
        private String codeSearchUrl = "";
        private String fixGenerationUrl = "";
        private String pullRequestUrl = "";
        private String ticketUrl = "";
        private SlackConfig slack = new SlackConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
            private String channel = "#general";
        }
    }
}
