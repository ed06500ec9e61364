package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.features.analysis.domain.QualityScore;
import com.apelier.aiengine.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityScorerTest {
    
    private QualityScorer scorer;
    
    @BeforeEach
    void setUp() {
        scorer = new QualityScorer();
    }
    
    @Test
    void scoresStayInRangeAndOverallIsWeightedSum() {
        List<Mat> images = List.of(
            TestImages.gray(200, 150, 0),
            TestImages.gray(200, 150, 255),
            TestImages.gray(200, 150, 128),
            TestImages.blocks(320, 240, 8, 7L),
            TestImages.tiltedHorizon(400, 300, 4)
        );
        for (Mat image : images) {
            QualityScore score = scorer.score(image);
            for (double value : new double[] {score.overall(), score.exposure(), score.sharpness(), score.noise(), score.composition()}) {
                assertTrue(value >= 0 && value <= 100, "score out of range: " + score);
            }
            double expected = 0.30 * score.exposure() + 0.30 * score.sharpness()
                    + 0.20 * score.noise() + 0.20 * score.composition();
            assertEquals(expected, score.overall(), 0.11, score.toString());
            image.release();
        }
    }
    
    @Test
    void midGrayIsWellExposedAndBlackIsNot() {
        Mat mid = TestImages.gray(100, 100, 128);
        Mat black = TestImages.gray(100, 100, 0);
        Mat midGray = new Mat();
        Mat blackGray = new Mat();
        Imgproc.cvtColor(mid, midGray, Imgproc.COLOR_BGR2GRAY);
        Imgproc.cvtColor(black, blackGray, Imgproc.COLOR_BGR2GRAY);
        
        assertEquals(100.0, scorer.exposureScore(midGray), 1e-9);
        assertEquals(0.0, scorer.exposureScore(blackGray), 1e-9);
    }
    
    @Test
    void flatImageHasNoNoise() {
        Mat flat = TestImages.gray(200, 200, 128);
        Mat gray = new Mat();
        Imgproc.cvtColor(flat, gray, Imgproc.COLOR_BGR2GRAY);
        
        assertEquals(100.0, scorer.noiseScore(gray), 1e-9);
    }
    
    @Test
    void blurLowersSharpness() {
        Mat sharp = TestImages.blocks(320, 320, 4, 3L);
        Mat blurred = new Mat();
        Imgproc.GaussianBlur(sharp, blurred, new Size(31, 31), 0);
        
        assertTrue(scorer.score(sharp).sharpness() > scorer.score(blurred).sharpness());
    }
    
    @Test
    void scoringIsDeterministic() {
        Mat image = TestImages.blocks(400, 300, 5, 11L);
        
        assertEquals(scorer.score(image), scorer.score(image));
    }
}
