package com.example.seer.collaborator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A source file returned by code search.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CodeFile(String filePath, String content, String repository, double score) {
}
