package com.example.seer.collaborator;

import java.time.Instant;

public record NotificationReceipt(String channel, Instant sentAt) {
}
