package com.apelier.aiengine.features.pipeline.domain;

/**
 * Input of one pipeline run. Photographer and shoot job ids are optional and resolved from the gallery when absent;
 * without a style profile the style phase is skipped.
 */
public record PipelineRequest(
    String galleryId,
    String processingJobId,
    String photographerId,
    String jobId,
    String styleProfileId
) {
    
    public PipelineRequest {
        if (galleryId == null || galleryId.isBlank()) {
            throw new IllegalArgumentException("Gallery ID cannot be blank");
        }
        if (processingJobId == null || processingJobId.isBlank()) {
            throw new IllegalArgumentException("Processing job ID cannot be blank");
        }
    }
    
    public static PipelineRequest of(String galleryId, String processingJobId, String styleProfileId) {
        return new PipelineRequest(galleryId, processingJobId, null, null, styleProfileId);
    }
}
