package com.apelier.aiengine.features.analysis.infra;

import com.apelier.aiengine.common.config.AnalysisProperties;
import com.apelier.aiengine.features.analysis.app.ImageDecoder;
import com.apelier.aiengine.features.analysis.domain.FaceBox;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CascadeFaceDetectorTest {
    
    // Webcam portrait, 320x213, one frontal face roughly at x 160..235, y 40..130
    private static final String PORTRAIT = "/faces/sinaface.jpg";
    
    private Mat portrait;
    
    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream(PORTRAIT)) {
            assertNotNull(in, "missing test fixture " + PORTRAIT);
            portrait = new ImageDecoder().decode(in.readAllBytes()).orElseThrow();
        }
    }
    
    @AfterEach
    void tearDown() {
        portrait.release();
    }
    
    @Test
    void loadsBundledCascadeWithoutConfiguration() {
        CascadeFaceDetector detector = new CascadeFaceDetector(new AnalysisProperties());
        
        assertTrue(detector.isEnabled());
    }
    
    @Test
    void fallsBackToBundledCascadeWhenConfiguredFileIsMissing() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.setFaceCascadePath("/nonexistent/haarcascade.xml");
        
        assertTrue(new CascadeFaceDetector(properties).isEnabled());
    }
    
    @Test
    void findsTheFaceInAPortrait() {
        CascadeFaceDetector detector = new CascadeFaceDetector(new AnalysisProperties());
        
        List<FaceBox> faces = detector.detect(portrait);
        
        assertFalse(faces.isEmpty(), "no face found in " + PORTRAIT);
        FaceBox face = largest(faces);
        assertTrue(face.centerX() > 150 && face.centerX() < 250, "face centre x was " + face.centerX());
        assertTrue(face.centerY() > 40 && face.centerY() < 150, "face centre y was " + face.centerY());
        assertTrue(face.width() >= 30 && face.width() < 160, "face width was " + face.width());
    }
    
    @Test
    void scalesBoxesBackToOriginalCoordinatesForLargeImages() {
        CascadeFaceDetector detector = new CascadeFaceDetector(new AnalysisProperties());
        FaceBox small = largest(detector.detect(portrait));
        
        int factor = 6;
        Mat large = new Mat();
        Imgproc.resize(portrait, large, new Size(portrait.cols() * factor, portrait.rows() * factor), 0, 0, Imgproc.INTER_CUBIC);
        try {
            assertTrue(Math.max(large.cols(), large.rows()) > 1500);
            
            List<FaceBox> faces = detector.detect(large);
            
            assertFalse(faces.isEmpty());
            FaceBox face = largest(faces);
            // Same face, in the large image's pixel space
            assertEquals(small.centerX() * factor, face.centerX(), small.width() * factor * 0.25);
            assertEquals(small.centerY() * factor, face.centerY(), small.height() * factor * 0.25);
            double widthRatio = (double) face.width() / (small.width() * factor);
            assertTrue(widthRatio > 0.7 && widthRatio < 1.4, "width ratio was " + widthRatio);
            assertTrue(face.x() + face.width() <= large.cols());
            assertTrue(face.y() + face.height() <= large.rows());
        } finally {
            large.release();
        }
    }
    
    private static FaceBox largest(List<FaceBox> faces) {
        return faces.stream()
            .max((a, b) -> Integer.compare(a.width() * a.height(), b.width() * b.height()))
            .orElseThrow();
    }
}
