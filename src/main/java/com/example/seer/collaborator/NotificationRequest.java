package com.example.seer.collaborator;

import com.example.seer.domain.Severity;

public record NotificationRequest(Severity severity, String incidentId, String title, String message,
                                  boolean actionRequired) {
}
