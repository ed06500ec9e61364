package com.apelier.aiengine.features.gpu.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One image of a style batch. The service reads {@code imageKey} and writes the styled JPEG to {@code outputKey}.
 * In responses {@code status} is set per image; in requests it is left null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StyleBatchItem(String imageKey, String outputKey, String status) {
    
    public StyleBatchItem(String imageKey, String outputKey) {
        this(imageKey, outputKey, null);
    }
}
