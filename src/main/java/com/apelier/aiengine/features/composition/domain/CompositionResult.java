package com.apelier.aiengine.features.composition.domain;

import org.opencv.core.Mat;

/**
 * Adjusted image plus what was changed. When neither flag is set, {@code image} is an unmodified copy.
 * The caller owns {@code image} and must release it.
 */
public record CompositionResult(
    Mat image,
    boolean straightened,
    Double horizonAngle,
    boolean cropped,
    CropRect cropRect
) {
    
    public static CompositionResult unchanged(Mat image) {
        return new CompositionResult(image, false, null, false, null);
    }
    
    public boolean changed() {
        return straightened || cropped;
    }
}
