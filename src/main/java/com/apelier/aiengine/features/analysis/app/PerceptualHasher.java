package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * DCT perceptual hash: 32x32 grayscale, discrete cosine transform, top-left 8x8 coefficients
 * binarised against their median. The fingerprint is a 64-character string of '0' and '1'.
 */
@Component
public class PerceptualHasher {
    
    public static final int HASH_BITS = 64;
    
    private static final int SAMPLE_SIZE = 32;
    private static final int LOW_FREQUENCY_SIZE = 8;
    
    public PerceptualHasher() {
        OpenCvNatives.ensureLoaded();
    }
    
    public String hash(Mat image) {
        Mat resized = new Mat();
        Mat gray = null;
        Mat floating = new Mat();
        Mat dct = new Mat();
        try {
            Imgproc.resize(image, resized, new Size(SAMPLE_SIZE, SAMPLE_SIZE));
            gray = ImageMats.toGray(resized);
            gray.convertTo(floating, CvType.CV_32F);
            Core.dct(floating, dct);
            
            double[] coefficients = new double[LOW_FREQUENCY_SIZE * LOW_FREQUENCY_SIZE];
            for (int row = 0; row < LOW_FREQUENCY_SIZE; row++) {
                for (int col = 0; col < LOW_FREQUENCY_SIZE; col++) {
                    coefficients[row * LOW_FREQUENCY_SIZE + col] = dct.get(row, col)[0];
                }
            }
            
            double median = median(coefficients);
            StringBuilder bits = new StringBuilder(HASH_BITS);
            for (double coefficient : coefficients) {
                bits.append(coefficient > median ? '1' : '0');
            }
            return bits.toString();
        } finally {
            ImageMats.release(resized, gray, floating, dct);
        }
    }
    
    /**
     * Number of positions at which two fingerprints differ. Extra trailing bits of the longer one are ignored.
     */
    public static int hammingDistance(String first, String second) {
        int length = Math.min(first.length(), second.length());
        int distance = 0;
        for (int i = 0; i < length; i++) {
            if (first.charAt(i) != second.charAt(i)) {
                distance++;
            }
        }
        return distance;
    }
    
    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[middle - 1] + sorted[middle]) / 2.0;
        }
        return sorted[middle];
    }
}
