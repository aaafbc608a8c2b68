package com.example.seer.domain.converter;

import com.example.seer.domain.AnomalyResult;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class AnomalyResultConverter extends JsonAttributeConverter<AnomalyResult> {
    public AnomalyResultConverter() {
        super(new TypeReference<>() {});
    }
}
