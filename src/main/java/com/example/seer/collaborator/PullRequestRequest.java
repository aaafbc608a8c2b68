package com.example.seer.collaborator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PullRequestRequest(String title, String description, String branch,
                                 List<FileChange> files, String incidentId) {
}
