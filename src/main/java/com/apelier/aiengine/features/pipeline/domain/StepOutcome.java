package com.apelier.aiengine.features.pipeline.domain;

/**
 * What one phase did with one photo.
 */
public record StepOutcome(String photoId, StepStatus status, SkipReason skipReason, String detail) {
    
    public static StepOutcome applied(String photoId) {
        return new StepOutcome(photoId, StepStatus.APPLIED, null, null);
    }
    
    public static StepOutcome unchanged(String photoId) {
        return new StepOutcome(photoId, StepStatus.UNCHANGED, null, null);
    }
    
    public static StepOutcome skipped(String photoId, SkipReason reason, String detail) {
        return new StepOutcome(photoId, StepStatus.SKIPPED, reason, detail);
    }
    
    public static StepOutcome skipped(String photoId, SkipReason reason) {
        return skipped(photoId, reason, null);
    }
    
    public boolean isSkipped() {
        return status == StepStatus.SKIPPED;
    }
}
