package com.example.seer.domain.converter;

import com.example.seer.domain.WorkflowStepResult;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class StepResultsConverter extends JsonAttributeConverter<List<WorkflowStepResult>> {
    public StepResultsConverter() {
        super(new TypeReference<>() {});
    }
}
