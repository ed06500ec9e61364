package com.apelier.aiengine.features.gallery.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * The {@code photos.ai_edits} document. Each phase owns one field and replaces only that field;
 * fields never written stay absent from the stored JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AiEdits(
    String styleApplied,
    Boolean hasPreset,
    FaceRetouch faceRetouch,
    SceneCleanup sceneCleanup,
    Composition composition,
    String pipelineVersion
) {
    
    public static final String NEURAL_STYLE = "neural_lut";
    
    public static AiEdits empty() {
        return new AiEdits(null, null, null, null, null, null);
    }
    
    public AiEdits withStyle(String styleApplied) {
        return new AiEdits(styleApplied, true, faceRetouch, sceneCleanup, composition, pipelineVersion);
    }
    
    public AiEdits withFaceRetouch(FaceRetouch faceRetouch) {
        return new AiEdits(styleApplied, hasPreset, faceRetouch, sceneCleanup, composition, pipelineVersion);
    }
    
    public AiEdits withSceneCleanup(SceneCleanup sceneCleanup) {
        return new AiEdits(styleApplied, hasPreset, faceRetouch, sceneCleanup, composition, pipelineVersion);
    }
    
    public AiEdits withComposition(Composition composition) {
        return new AiEdits(styleApplied, hasPreset, faceRetouch, sceneCleanup, composition, pipelineVersion);
    }
    
    public AiEdits withRunStamp(String pipelineVersion, boolean hasPreset) {
        return new AiEdits(styleApplied, hasPreset, faceRetouch, sceneCleanup, composition, pipelineVersion);
    }
    
    public boolean isStyled() {
        return styleApplied != null;
    }
    
    public boolean isFaceRetouched() {
        return faceRetouch != null;
    }
    
    public boolean isHorizonCorrected() {
        return composition != null && Boolean.TRUE.equals(composition.horizonCorrected());
    }
    
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record FaceRetouch(int faces, double fidelity) {
    }
    
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SceneCleanup(int detections, double coveragePct) {
    }
    
    /**
     * Either {@code {evaluated: true, changes: false}} or the correction that was applied.
     * {@code cropRect} is {@code [x, y, width, height]} in pre-crop pixels.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Composition(
        Boolean evaluated,
        Boolean changes,
        Boolean horizonCorrected,
        Double horizonAngle,
        Boolean cropApplied,
        List<Integer> cropRect
    ) {
        
        public static Composition noChanges() {
            return new Composition(true, false, null, null, null, null);
        }
        
        public static Composition applied(Double horizonAngle, List<Integer> cropRect) {
            return new Composition(true, true,
                    horizonAngle != null ? true : null, horizonAngle,
                    cropRect != null ? true : null, cropRect);
        }
    }
}
