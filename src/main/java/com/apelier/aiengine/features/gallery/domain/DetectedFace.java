package com.apelier.aiengine.features.gallery.domain;

import com.apelier.aiengine.features.analysis.domain.FaceBox;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Stored and wire form of one detected face: {@code {"bbox": [x, y, w, h], "eyes_open": true}}.
 * The front end and the GPU retouch endpoint both read this shape.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DetectedFace(List<Integer> bbox, boolean eyesOpen) {
    
    public static DetectedFace from(FaceBox box) {
        return new DetectedFace(List.of(box.x(), box.y(), box.width(), box.height()), true);
    }
    
    public FaceBox toBox() {
        if (bbox == null || bbox.size() < 4) {
            return null;
        }
        return new FaceBox(bbox.get(0), bbox.get(1), bbox.get(2), bbox.get(3));
    }
}
