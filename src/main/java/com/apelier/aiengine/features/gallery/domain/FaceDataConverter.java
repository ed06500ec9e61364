package com.apelier.aiengine.features.gallery.domain;

import com.apelier.aiengine.common.json.JsonAttributeConverter;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class FaceDataConverter extends JsonAttributeConverter<List<DetectedFace>> {
    
    public FaceDataConverter() {
        super(new TypeReference<>() { });
    }
}
