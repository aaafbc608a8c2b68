package com.example.seer.collaborator;

import com.example.seer.config.SeerProperties;
import com.example.seer.exception.CollaboratorException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Sends incident notifications to a Slack incoming webhook. When Slack is
 * disabled the message is only written to the log and reported as
 * delivered on the "log" channel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlackNotificationSender implements NotificationSender {

    static final String NAME = "slack";
    private static final MediaType JSON = MediaType.get("application/json");

    private final SeerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public NotificationReceipt send(NotificationRequest notification) {
        SeerProperties.CollaboratorsConfig.SlackConfig slack = properties.getCollaborators().getSlack();
        if (!slack.isEnabled()) {
            log.info("Notification for {} (Slack disabled): {} - {}",
                    notification.incidentId(), notification.title(), notification.message());
            return new NotificationReceipt("log", clock.instant());
        }
        String webhookUrl = slack.getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            throw new CollaboratorException(NAME, "webhook URL not configured");
        }

        String emoji = switch (notification.severity()) {
            case SEV_1 -> ":rotating_light:";
            case SEV_2 -> ":warning:";
            case SEV_3 -> ":information_source:";
        };

        Map<String, Object> payload = Map.of(
                "channel", slack.getChannel(),
                "text", String.format("%s *[%s] %s*\nIncident: %s\n%s%s",
                        emoji, notification.severity().getLabel(), notification.title(),
                        notification.incidentId(), notification.message(),
                        notification.actionRequired() ? "\n:point_right: Action required" : ""),
                "username", "Seer",
                "icon_emoji", ":crystal_ball:"
        );

        try {
            String json = objectMapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(json, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new CollaboratorException(NAME, "webhook returned " + response.code());
                }
            }
        } catch (IOException e) {
            throw new CollaboratorException(NAME, e.getMessage(), e);
        }
        log.info("Slack notification sent for incident {}", notification.incidentId());
        return new NotificationReceipt(slack.getChannel(), clock.instant());
    }
}
