package com.example.seer.domain.converter;

import com.example.seer.domain.Remediation;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class RemediationConverter extends JsonAttributeConverter<Remediation> {
    public RemediationConverter() {
        super(new TypeReference<>() {});
    }
}
