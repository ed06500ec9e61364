package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.AiEdits;
import org.springframework.stereotype.Component;

/**
 * Confidence (0-100) that a photo is ready for delivery: its quality score plus a bonus per automated edit.
 */
@Component
public class EditConfidenceCalculator {
    
    static final double DEFAULT_QUALITY = 50.0;
    static final double STYLE_BONUS = 5.0;
    static final double FACE_RETOUCH_BONUS = 3.0;
    static final double HORIZON_BONUS = 2.0;
    
    public double calculate(Double qualityScore, AiEdits edits) {
        double confidence = Math.min(100.0, qualityScore != null ? qualityScore : DEFAULT_QUALITY);
        if (edits == null) {
            return confidence;
        }
        if (edits.isStyled()) {
            confidence = Math.min(100.0, confidence + STYLE_BONUS);
        }
        if (edits.isFaceRetouched()) {
            confidence = Math.min(100.0, confidence + FACE_RETOUCH_BONUS);
        }
        if (edits.isHorizonCorrected()) {
            confidence = Math.min(100.0, confidence + HORIZON_BONUS);
        }
        return confidence;
    }
}
