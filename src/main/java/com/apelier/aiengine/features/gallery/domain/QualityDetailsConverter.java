package com.apelier.aiengine.features.gallery.domain;

import com.apelier.aiengine.common.json.JsonAttributeConverter;
import com.apelier.aiengine.features.analysis.domain.QualityScore;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class QualityDetailsConverter extends JsonAttributeConverter<QualityScore> {
    
    public QualityDetailsConverter() {
        super(new TypeReference<>() { });
    }
}
