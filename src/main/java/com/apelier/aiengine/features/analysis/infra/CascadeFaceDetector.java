package com.apelier.aiengine.features.analysis.infra;

import com.apelier.aiengine.common.config.AnalysisProperties;
import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import com.apelier.aiengine.features.analysis.domain.FaceBox;
import com.apelier.aiengine.features.analysis.domain.FaceDetector;
import org.opencv.core.Mat;
import org.opencv.core.MatOfRect;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Haar-cascade frontal face detector.
 * Detection runs on a grayscale copy downscaled to at most 1500px; boxes are scaled back.
 * Uses the frontal-face cascade bundled on the classpath unless {@code app.analysis.face-cascade-path}
 * points at a readable file. If no cascade can be loaded the detector reports no faces.
 */
@Component
public class CascadeFaceDetector implements FaceDetector {
    
    private static final Logger log = LoggerFactory.getLogger(CascadeFaceDetector.class);
    
    static final String BUNDLED_CASCADE = "cascades/haarcascade_frontalface_default.xml";
    
    private static final int MAX_DETECTION_DIMENSION = 1500;
    private static final double SCALE_FACTOR = 1.1;
    private static final int MIN_NEIGHBORS = 5;
    private static final Size MIN_FACE_SIZE = new Size(30, 30);
    
    private final CascadeClassifier classifier;
    
    public CascadeFaceDetector(AnalysisProperties analysisProperties) {
        OpenCvNatives.ensureLoaded();
        this.classifier = loadClassifier(analysisProperties.getFaceCascadePath());
    }
    
    private static CascadeClassifier loadClassifier(String configuredPath) {
        if (configuredPath != null && !configuredPath.isBlank()) {
            if (Files.isReadable(Path.of(configuredPath))) {
                return loadFromFile(configuredPath);
            }
            log.warn("Face cascade not found at '{}', falling back to the bundled cascade", configuredPath);
        }
        return loadBundled();
    }
    
    // CascadeClassifier only reads from the filesystem, so the bundled resource is copied out first
    private static CascadeClassifier loadBundled() {
        ClassPathResource resource = new ClassPathResource(BUNDLED_CASCADE);
        if (!resource.exists()) {
            log.warn("Bundled face cascade {} is missing, face detection is disabled", BUNDLED_CASCADE);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            Path copy = Files.createTempFile("haarcascade_frontalface", ".xml");
            copy.toFile().deleteOnExit();
            Files.copy(in, copy, StandardCopyOption.REPLACE_EXISTING);
            return loadFromFile(copy.toString());
        } catch (IOException e) {
            log.warn("Could not extract bundled face cascade, face detection is disabled", e);
            return null;
        }
    }
    
    private static CascadeClassifier loadFromFile(String cascadePath) {
        CascadeClassifier loaded = new CascadeClassifier(cascadePath);
        if (loaded.empty()) {
            log.warn("Face cascade at '{}' could not be parsed, face detection is disabled", cascadePath);
            return null;
        }
        log.info("Loaded face cascade from {}", cascadePath);
        return loaded;
    }
    
    public boolean isEnabled() {
        return classifier != null;
    }
    
    // CascadeClassifier keeps per-call scratch state, so concurrent pipeline runs take turns
    @Override
    public synchronized List<FaceBox> detect(Mat image) {
        if (classifier == null) {
            return List.of();
        }
        
        Mat gray = ImageMats.toGray(image);
        Mat detectionCopy = new Mat();
        MatOfRect found = new MatOfRect();
        try {
            double scale = 1.0;
            int longest = Math.max(gray.rows(), gray.cols());
            if (longest > MAX_DETECTION_DIMENSION) {
                scale = (double) MAX_DETECTION_DIMENSION / longest;
                Imgproc.resize(gray, detectionCopy, new Size(), scale, scale, Imgproc.INTER_AREA);
            } else {
                gray.copyTo(detectionCopy);
            }
            
            classifier.detectMultiScale(detectionCopy, found, SCALE_FACTOR, MIN_NEIGHBORS, 0, MIN_FACE_SIZE, new Size());
            
            List<FaceBox> faces = new ArrayList<>();
            for (Rect rect : found.toArray()) {
                faces.add(new FaceBox(
                    (int) (rect.x / scale),
                    (int) (rect.y / scale),
                    (int) (rect.width / scale),
                    (int) (rect.height / scale)
                ));
            }
            return faces;
        } finally {
            ImageMats.release(gray, detectionCopy, found);
        }
    }
}
