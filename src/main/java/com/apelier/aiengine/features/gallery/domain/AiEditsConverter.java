package com.apelier.aiengine.features.gallery.domain;

import com.apelier.aiengine.common.json.JsonAttributeConverter;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class AiEditsConverter extends JsonAttributeConverter<AiEdits> {
    
    public AiEditsConverter() {
        super(new TypeReference<>() { });
    }
}
