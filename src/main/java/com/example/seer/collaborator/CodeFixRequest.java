package com.example.seer.collaborator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CodeFixRequest(String filePath, String diagnosis, String currentCode, String context) {
}
