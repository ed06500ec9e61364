package com.apelier.aiengine.features.gpu.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StyleBatchResult(String status, String message, List<StyleBatchItem> results) {
    
    public static StyleBatchResult error(String message) {
        return new StyleBatchResult(GpuCallStatus.ERROR, message, List.of());
    }
    
    public boolean isError() {
        return status == null || GpuCallStatus.ERROR.equals(status) || GpuCallStatus.UNAVAILABLE.equals(status);
    }
}
