package com.example.seer.collaborator;

/**
 * Tells the owning team about an incident.
 */
public interface NotificationSender {

    NotificationReceipt send(NotificationRequest request);
}
