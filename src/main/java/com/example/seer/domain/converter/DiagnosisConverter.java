package com.example.seer.domain.converter;

import com.example.seer.domain.Diagnosis;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class DiagnosisConverter extends JsonAttributeConverter<Diagnosis> {
    public DiagnosisConverter() {
        super(new TypeReference<>() {});
    }
}
