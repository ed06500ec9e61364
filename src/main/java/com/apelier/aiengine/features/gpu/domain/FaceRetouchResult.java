package com.apelier.aiengine.features.gpu.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FaceRetouchResult(String status, int facesFound, String message) {
    
    public static FaceRetouchResult error(String message) {
        return new FaceRetouchResult(GpuCallStatus.ERROR, 0, message);
    }
    
    public boolean isSuccess() {
        return GpuCallStatus.SUCCESS.equals(status);
    }
}
