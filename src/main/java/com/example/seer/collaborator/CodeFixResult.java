package com.example.seer.collaborator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CodeFixResult(String fixedCode, String explanation, List<String> recommendations) {

    public CodeFixResult {
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
