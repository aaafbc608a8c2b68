package com.example.seer.domain;

import com.example.seer.exception.ConsistencyViolationException;

/**
 * The fix applied to an incident, as far as it got through the pipeline.
 */
public record Remediation(String filePath, String explanation, Integer prNumber, String prUrl, String branch) {

    public Remediation {
        if (filePath == null || filePath.isBlank()) {
            throw new ConsistencyViolationException("Remediation requires the fixed file path");
        }
    }
}
