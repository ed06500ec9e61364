package com.apelier.aiengine.features.gallery.domain;

import com.apelier.aiengine.common.json.JsonAttributeConverter;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class ExifDataConverter extends JsonAttributeConverter<Map<String, String>> {
    
    public ExifDataConverter() {
        super(new TypeReference<>() { });
    }
}
