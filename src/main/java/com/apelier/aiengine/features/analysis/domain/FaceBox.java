package com.apelier.aiengine.features.analysis.domain;

/**
 * Face bounding box in original-image pixel coordinates.
 */
public record FaceBox(int x, int y, int width, int height) {
    
    public FaceBox {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Face box size cannot be negative");
        }
    }
    
    public double centerX() {
        return x + width / 2.0;
    }
    
    public double centerY() {
        return y + height / 2.0;
    }
}
