package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import com.apelier.aiengine.features.analysis.domain.ContrastClass;
import com.apelier.aiengine.features.analysis.domain.ImageCharacteristics;
import com.apelier.aiengine.features.analysis.domain.SaturationClass;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tone and colour statistics from the LAB and HSV colour spaces, used to adapt edits per image.
 */
@Component
public class CharacteristicsAnalyzer {
    
    static final double LOW_CONTRAST = 35;
    static final double HIGH_CONTRAST = 65;
    static final double DARK_CLIP_LEVEL = 10;
    static final double BRIGHT_CLIP_LEVEL = 245;
    static final double BACKLIT_MARGIN = 30;
    static final double DESATURATED = 40;
    static final double OVERSATURATED = 180;
    static final double NOISY_SIGMA = 8;
    
    public CharacteristicsAnalyzer() {
        OpenCvNatives.ensureLoaded();
    }
    
    public ImageCharacteristics analyze(Mat image) {
        Mat lab = new Mat();
        Mat hsv = new Mat();
        Mat gray = ImageMats.toGray(image);
        List<Mat> labChannels = new ArrayList<>();
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stddev = new MatOfDouble();
        try {
            Imgproc.cvtColor(image, lab, Imgproc.COLOR_BGR2Lab);
            Imgproc.cvtColor(image, hsv, Imgproc.COLOR_BGR2HSV);
            Core.split(lab, labChannels);
            Mat luminance = labChannels.get(0);
            
            Core.meanStdDev(luminance, mean, stddev);
            double meanBrightness = mean.toArray()[0];
            double exposureBias = (meanBrightness - 128.0) / 128.0;
            double contrast = stddev.toArray()[0];
            
            Scalar labMean = Core.mean(lab);
            double meanSaturation = Core.mean(hsv).val[1];
            double noiseSigma = QualityScorer.meanHighPassResidual(gray);
            
            double[] histogram = QualityScorer.histogram(luminance);
            double p2 = percentile(histogram, luminance.total(), 2);
            double p98 = percentile(histogram, luminance.total(), 98);
            
            return new ImageCharacteristics(
                meanBrightness,
                round(exposureBias, 3),
                contrast,
                contrastClass(contrast),
                round(fraction(histogram, 0, (int) DARK_CLIP_LEVEL, luminance.total()), 4),
                round(fraction(histogram, (int) BRIGHT_CLIP_LEVEL + 1, 256, luminance.total()), 4),
                isBacklit(luminance),
                labMean.val[2],
                labMean.val[1],
                meanSaturation,
                saturationClass(meanSaturation),
                round(noiseSigma, 2),
                noiseSigma > NOISY_SIGMA,
                round(p2, 1),
                round(p98, 1),
                round(p98 - p2, 1)
            );
        } finally {
            ImageMats.release(lab, hsv, gray, mean, stddev);
            labChannels.forEach(Mat::release);
        }
    }
    
    static ContrastClass contrastClass(double contrast) {
        if (contrast < LOW_CONTRAST) {
            return ContrastClass.LOW;
        }
        if (contrast > HIGH_CONTRAST) {
            return ContrastClass.HIGH;
        }
        return ContrastClass.NORMAL;
    }
    
    static SaturationClass saturationClass(double saturation) {
        if (saturation < DESATURATED) {
            return SaturationClass.DESATURATED;
        }
        if (saturation > OVERSATURATED) {
            return SaturationClass.OVERSATURATED;
        }
        return SaturationClass.NORMAL;
    }
    
    /**
     * Backlit when the mean of the four quarter-width border strips is more than 30 levels
     * brighter than the central half of the frame.
     */
    static boolean isBacklit(Mat luminance) {
        int h = luminance.rows();
        int w = luminance.cols();
        int centerH = h / 4;
        int centerW = w / 4;
        if (centerH == 0 || centerW == 0) {
            return false;
        }
        
        double center = regionMean(luminance, centerH, 3 * centerH, centerW, 3 * centerW);
        double border = (regionMean(luminance, 0, centerH, 0, w)
                + regionMean(luminance, 3 * centerH, h, 0, w)
                + regionMean(luminance, 0, h, 0, centerW)
                + regionMean(luminance, 0, h, 3 * centerW, w)) / 4.0;
        return border > center + BACKLIT_MARGIN;
    }
    
    private static double regionMean(Mat mat, int rowStart, int rowEnd, int colStart, int colEnd) {
        Mat region = mat.submat(rowStart, rowEnd, colStart, colEnd);
        try {
            return Core.mean(region).val[0];
        } finally {
            region.release();
        }
    }
    
    private static double fraction(double[] histogram, int fromInclusive, int toExclusive, long total) {
        double count = 0;
        for (int i = fromInclusive; i < toExclusive; i++) {
            count += histogram[i];
        }
        return count / total;
    }
    
    /**
     * Percentile of 8-bit values from their histogram, interpolating linearly between neighbouring ranks.
     */
    static double percentile(double[] histogram, long total, double percent) {
        double rank = percent / 100.0 * (total - 1);
        long lowerRank = (long) Math.floor(rank);
        long upperRank = (long) Math.ceil(rank);
        double lower = valueAtRank(histogram, lowerRank);
        double upper = valueAtRank(histogram, upperRank);
        return lower + (upper - lower) * (rank - lowerRank);
    }
    
    private static double valueAtRank(double[] histogram, long rank) {
        double cumulative = 0;
        for (int value = 0; value < histogram.length; value++) {
            cumulative += histogram[value];
            if (cumulative > rank) {
                return value;
            }
        }
        return histogram.length - 1;
    }
    
    private static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
