package com.apelier.aiengine.features.gpu.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneCleanupResult(String status, int detectionsFound, double maskCoveragePct, String message) {
    
    public static SceneCleanupResult error(String message) {
        return new SceneCleanupResult(GpuCallStatus.ERROR, 0, 0.0, message);
    }
    
    public boolean isSuccess() {
        return GpuCallStatus.SUCCESS.equals(status);
    }
}
