package com.apelier.aiengine.features.analysis.domain;

import java.util.List;
import java.util.Map;

/**
 * Everything the analysis engine learns about one image. Width and height are the
 * original image's dimensions, not those of the downscaled analysis copy.
 */
public record AnalysisResult(
    Map<String, String> exif,
    SceneType sceneType,
    QualityScore quality,
    List<FaceBox> faces,
    String perceptualHash,
    int width,
    int height,
    ImageCharacteristics characteristics
) {
    
    public AnalysisResult {
        exif = exif == null ? Map.of() : Map.copyOf(exif);
        faces = faces == null ? List.of() : List.copyOf(faces);
    }
    
    public int faceCount() {
        return faces.size();
    }
    
    public double qualityScore() {
        return quality.overall();
    }
}
