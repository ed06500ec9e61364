package com.apelier.aiengine.features.gallery.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ProcessingStatusConverter implements AttributeConverter<ProcessingStatus, String> {
    
    @Override
    public String convertToDatabaseColumn(ProcessingStatus status) {
        return status == null ? null : status.value();
    }
    
    @Override
    public ProcessingStatus convertToEntityAttribute(String value) {
        return value == null ? null : ProcessingStatus.fromValue(value);
    }
}
