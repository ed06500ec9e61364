package com.apelier.aiengine.features.gpu.infra;

import com.apelier.aiengine.features.gallery.domain.DetectedFace;
import com.apelier.aiengine.features.gpu.domain.StyleBatchItem;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Request bodies for the GPU service endpoints.
 */
final class GpuRequests {
    
    private GpuRequests() {
    }
    
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StyleBatchRequest(List<StyleBatchItem> images, String modelFilename, int jpegQuality) {
    }
    
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record FaceRetouchRequest(String imageKey, String outputKey, double fidelity, List<DetectedFace> faceData) {
    }
    
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SceneCleanupRequest(String imageKey, String outputKey, List<String> detections) {
    }
}
