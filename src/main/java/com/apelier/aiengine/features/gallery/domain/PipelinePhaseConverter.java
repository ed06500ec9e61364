package com.apelier.aiengine.features.gallery.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class PipelinePhaseConverter implements AttributeConverter<PipelinePhase, String> {
    
    @Override
    public String convertToDatabaseColumn(PipelinePhase phase) {
        return phase == null ? null : phase.value();
    }
    
    @Override
    public PipelinePhase convertToEntityAttribute(String value) {
        return value == null ? null : PipelinePhase.fromValue(value);
    }
}
