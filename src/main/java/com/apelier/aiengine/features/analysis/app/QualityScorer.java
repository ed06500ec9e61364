package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import com.apelier.aiengine.features.analysis.domain.QualityScore;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfFloat;
import org.opencv.core.MatOfInt;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Scores exposure, sharpness, noise and rule-of-thirds composition, each on a 0-100 scale.
 */
@Component
public class QualityScorer {
    
    private static final int NOISE_PATCHES = 10;
    private static final int NOISE_PATCH_SIZE = 32;
    private static final long NOISE_SEED = 42L;
    private static final int THIRDS_ZONE_HALF = 20;
    
    public QualityScorer() {
        OpenCvNatives.ensureLoaded();
    }
    
    public QualityScore score(Mat image) {
        Mat gray = ImageMats.toGray(image);
        try {
            return QualityScore.of(
                exposureScore(gray),
                sharpnessScore(gray),
                noiseScore(gray),
                compositionScore(gray)
            );
        } finally {
            gray.release();
        }
    }
    
    /**
     * Peaks for a mean brightness in [90, 170], falls off linearly outside it,
     * then loses up to 30 points for pixels piled up at either end of the histogram.
     */
    double exposureScore(Mat gray) {
        double[] histogram = histogram(gray);
        double total = gray.total();
        double mean = Core.mean(gray).val[0];
        
        double score;
        if (mean >= 90 && mean <= 170) {
            score = 90 + 10 * (1 - Math.abs(mean - 128) / 42);
        } else if (mean < 90) {
            score = Math.max(20, 90 * (mean / 90));
        } else {
            score = Math.max(20, 90 * ((255 - mean) / 85));
        }
        
        double clipped = 0;
        for (int i = 0; i < 5; i++) {
            clipped += histogram[i];
        }
        for (int i = 250; i < 256; i++) {
            clipped += histogram[i];
        }
        score -= Math.min(30, (clipped / total) * 200);
        return clamp(score, 0, 100);
    }
    
    /**
     * Variance of the Laplacian, mapped as (variance - 10) / 5.
     */
    double sharpnessScore(Mat gray) {
        Mat laplacian = new Mat();
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stddev = new MatOfDouble();
        try {
            Imgproc.Laplacian(gray, laplacian, CvType.CV_64F);
            Core.meanStdDev(laplacian, mean, stddev);
            double sigma = stddev.toArray()[0];
            return clamp((sigma * sigma - 10) / 5, 0, 100);
        } finally {
            ImageMats.release(laplacian, mean, stddev);
        }
    }
    
    /**
     * Mean high-pass residual over ten fixed-seed 32x32 patches.
     * Below about 3 the image is clean, above 15 it is very noisy.
     */
    double noiseScore(Mat gray) {
        Random random = new Random(NOISE_SEED);
        int rows = gray.rows();
        int cols = gray.cols();
        double sum = 0;
        
        for (int i = 0; i < NOISE_PATCHES; i++) {
            int y = random.nextInt(Math.max(1, rows - NOISE_PATCH_SIZE));
            int x = random.nextInt(Math.max(1, cols - NOISE_PATCH_SIZE));
            Mat patch = gray.submat(y, Math.min(rows, y + NOISE_PATCH_SIZE), x, Math.min(cols, x + NOISE_PATCH_SIZE));
            sum += meanHighPassResidual(patch);
            patch.release();
        }
        
        double averageNoise = sum / NOISE_PATCHES;
        return clamp(100 - (averageNoise - 2) * 7, 0, 100);
    }
    
    /**
     * Share of strong edges that fall in the four rule-of-thirds intersection zones, mapped as 50 + ratio * 500.
     */
    double compositionScore(Mat gray) {
        Mat edges = new Mat();
        try {
            Imgproc.Canny(gray, edges, 80, 200);
            int rows = edges.rows();
            int cols = edges.cols();
            int thirdH = rows / 3;
            int thirdW = cols / 3;
            
            int zoneActivity = 0;
            for (int cy : new int[] {thirdH, 2 * thirdH}) {
                for (int cx : new int[] {thirdW, 2 * thirdW}) {
                    zoneActivity += countEdges(edges, cy, cx);
                }
            }
            
            int totalEdges = Math.max(1, Core.countNonZero(edges));
            double thirdsRatio = (double) zoneActivity / totalEdges;
            return clamp(50 + thirdsRatio * 500, 40, 100);
        } finally {
            edges.release();
        }
    }
    
    /**
     * Mean absolute difference between a grayscale region and its 5x5 Gaussian blur.
     */
    static double meanHighPassResidual(Mat gray) {
        Mat source = new Mat();
        Mat blurred = new Mat();
        Mat diff = new Mat();
        try {
            gray.convertTo(source, CvType.CV_64F);
            Imgproc.GaussianBlur(source, blurred, new Size(5, 5), 0);
            Core.absdiff(source, blurred, diff);
            return Core.mean(diff).val[0];
        } finally {
            ImageMats.release(source, blurred, diff);
        }
    }
    
    static double[] histogram(Mat gray) {
        Mat hist = new Mat();
        try {
            Imgproc.calcHist(List.of(gray), new MatOfInt(0), new Mat(), hist,
                    new MatOfInt(256), new MatOfFloat(0f, 256f));
            double[] bins = new double[256];
            for (int i = 0; i < 256; i++) {
                bins[i] = hist.get(i, 0)[0];
            }
            return bins;
        } finally {
            hist.release();
        }
    }
    
    private static int countEdges(Mat edges, int centerY, int centerX) {
        int top = Math.max(0, centerY - THIRDS_ZONE_HALF);
        int bottom = Math.min(edges.rows(), centerY + THIRDS_ZONE_HALF);
        int left = Math.max(0, centerX - THIRDS_ZONE_HALF);
        int right = Math.min(edges.cols(), centerX + THIRDS_ZONE_HALF);
        if (bottom <= top || right <= left) {
            return 0;
        }
        Mat zone = edges.submat(top, bottom, left, right);
        try {
            return Core.countNonZero(zone);
        } finally {
            zone.release();
        }
    }
    
    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
