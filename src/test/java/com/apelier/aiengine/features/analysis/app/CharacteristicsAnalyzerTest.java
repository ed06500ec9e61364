package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.features.analysis.domain.ContrastClass;
import com.apelier.aiengine.features.analysis.domain.ImageCharacteristics;
import com.apelier.aiengine.features.analysis.domain.SaturationClass;
import com.apelier.aiengine.support.TestImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import static org.junit.jupiter.api.Assertions.*;

class CharacteristicsAnalyzerTest {
    
    private final CharacteristicsAnalyzer analyzer = new CharacteristicsAnalyzer();
    
    @Test
    void classifiesContrastAndSaturationAtThresholds() {
        assertEquals(ContrastClass.LOW, CharacteristicsAnalyzer.contrastClass(34.9));
        assertEquals(ContrastClass.NORMAL, CharacteristicsAnalyzer.contrastClass(35));
        assertEquals(ContrastClass.NORMAL, CharacteristicsAnalyzer.contrastClass(65));
        assertEquals(ContrastClass.HIGH, CharacteristicsAnalyzer.contrastClass(65.1));
        
        assertEquals(SaturationClass.DESATURATED, CharacteristicsAnalyzer.saturationClass(39));
        assertEquals(SaturationClass.NORMAL, CharacteristicsAnalyzer.saturationClass(120));
        assertEquals(SaturationClass.OVERSATURATED, CharacteristicsAnalyzer.saturationClass(181));
    }
    
    @Test
    void brightBorderAroundDarkSubjectIsBacklit() {
        Mat luminance = new Mat(200, 200, CvType.CV_8UC1, new Scalar(220));
        Imgproc.rectangle(luminance, new Rect(50, 50, 100, 100), new Scalar(60), -1);
        
        assertTrue(CharacteristicsAnalyzer.isBacklit(luminance));
    }
    
    @Test
    void evenLightingIsNotBacklit() {
        Mat luminance = new Mat(200, 200, CvType.CV_8UC1, new Scalar(128));
        
        assertFalse(CharacteristicsAnalyzer.isBacklit(luminance));
    }
    
    @Test
    void percentileInterpolatesBetweenRanks() {
        double[] histogram = new double[256];
        histogram[10] = 50;
        histogram[200] = 50;
        
        assertEquals(10.0, CharacteristicsAnalyzer.percentile(histogram, 100, 2), 1e-9);
        assertEquals(200.0, CharacteristicsAnalyzer.percentile(histogram, 100, 98), 1e-9);
        assertEquals(105.0, CharacteristicsAnalyzer.percentile(histogram, 100, 50), 1e-9);
    }
    
    @Test
    void flatGrayImageIsNeutralLowContrastAndClean() {
        ImageCharacteristics characteristics = analyzer.analyze(TestImages.gray(160, 120, 128));
        
        assertEquals(ContrastClass.LOW, characteristics.contrastClass());
        assertEquals(SaturationClass.DESATURATED, characteristics.saturationClass());
        assertEquals(0.0, characteristics.contrast(), 1e-9);
        assertEquals(128.0, characteristics.whiteBalanceWarmth(), 1.0);
        assertEquals(128.0, characteristics.whiteBalanceTint(), 1.0);
        assertEquals(0.0, characteristics.dynamicRange(), 1e-9);
        assertFalse(characteristics.noisy());
        assertFalse(characteristics.backlit());
    }
}
