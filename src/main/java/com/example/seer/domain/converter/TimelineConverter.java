package com.example.seer.domain.converter;

import com.example.seer.domain.TimelineEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class TimelineConverter extends JsonAttributeConverter<List<TimelineEntry>> {
    public TimelineConverter() {
        super(new TypeReference<>() {});
    }
}
