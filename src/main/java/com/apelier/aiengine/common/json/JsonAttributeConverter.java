package com.apelier.aiengine.common.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Base converter for jsonb columns holding structured values.
 * Subclasses only supply the target type.
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {
    
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    
    private final TypeReference<T> type;
    
    protected JsonAttributeConverter(TypeReference<T> type) {
        this.type = type;
    }
    
    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise " + attribute.getClass().getSimpleName(), e);
        }
    }
    
    @Override
    public T convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read stored JSON as " + type.getType(), e);
        }
    }
}
