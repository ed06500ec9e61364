package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.config.AnalysisProperties;
import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.features.analysis.domain.AnalysisOutcome;
import com.apelier.aiengine.features.analysis.domain.AnalysisResult;
import com.apelier.aiengine.features.analysis.domain.FaceBox;
import com.apelier.aiengine.features.analysis.domain.FaceDetector;
import com.apelier.aiengine.features.analysis.domain.SceneType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-image analysis: EXIF, faces, scene type, quality scores, perceptual hash and tone characteristics.
 * <p>
 * Pure with respect to the rest of the system: no storage or network access. All measurements run on a
 * copy capped at {@code app.analysis.max-analysis-dimension}; reported dimensions and face boxes are in
 * original-image coordinates.
 */
@Service
public class AnalysisEngine {
    
    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);
    
    public static final String DECODE_FAILED = "Failed to decode image";
    
    private final ImageDecoder imageDecoder;
    private final ExifExtractor exifExtractor;
    private final FaceDetector faceDetector;
    private final SceneClassifier sceneClassifier;
    private final QualityScorer qualityScorer;
    private final PerceptualHasher perceptualHasher;
    private final CharacteristicsAnalyzer characteristicsAnalyzer;
    private final int maxAnalysisDimension;
    
    public AnalysisEngine(
            ImageDecoder imageDecoder,
            ExifExtractor exifExtractor,
            FaceDetector faceDetector,
            SceneClassifier sceneClassifier,
            QualityScorer qualityScorer,
            PerceptualHasher perceptualHasher,
            CharacteristicsAnalyzer characteristicsAnalyzer,
            AnalysisProperties analysisProperties) {
        this.imageDecoder = imageDecoder;
        this.exifExtractor = exifExtractor;
        this.faceDetector = faceDetector;
        this.sceneClassifier = sceneClassifier;
        this.qualityScorer = qualityScorer;
        this.perceptualHasher = perceptualHasher;
        this.characteristicsAnalyzer = characteristicsAnalyzer;
        this.maxAnalysisDimension = analysisProperties.getMaxAnalysisDimension();
    }
    
    public AnalysisOutcome analyse(byte[] imageBytes) {
        Optional<Mat> decoded = imageDecoder.decode(imageBytes);
        if (decoded.isEmpty()) {
            return AnalysisOutcome.failure(DECODE_FAILED);
        }
        
        Mat original = decoded.get();
        int width = original.cols();
        int height = original.rows();
        
        Mat analysisCopy = ImageMats.limitDimension(original, maxAnalysisDimension);
        // The full-resolution buffer is not needed past this point
        original.release();
        
        try {
            double toOriginal = (double) width / analysisCopy.cols();
            
            Map<String, String> exif = exifExtractor.extract(imageBytes);
            List<FaceBox> faces = rescale(faceDetector.detect(analysisCopy), toOriginal);
            SceneType scene = sceneClassifier.classify(analysisCopy, faces.size());
            
            AnalysisResult result = new AnalysisResult(
                exif,
                scene,
                qualityScorer.score(analysisCopy),
                faces,
                perceptualHasher.hash(analysisCopy),
                width,
                height,
                characteristicsAnalyzer.analyze(analysisCopy)
            );
            
            log.debug("Analysed {}x{} image: scene={}, quality={}, faces={}",
                width, height, scene.value(), result.qualityScore(), faces.size());
            return AnalysisOutcome.success(result);
        } finally {
            analysisCopy.release();
        }
    }
    
    private static List<FaceBox> rescale(List<FaceBox> faces, double factor) {
        if (factor == 1.0) {
            return faces;
        }
        List<FaceBox> scaled = new ArrayList<>(faces.size());
        for (FaceBox face : faces) {
            scaled.add(new FaceBox(
                (int) Math.round(face.x() * factor),
                (int) Math.round(face.y() * factor),
                (int) Math.round(face.width() * factor),
                (int) Math.round(face.height() * factor)
            ));
        }
        return scaled;
    }
}
