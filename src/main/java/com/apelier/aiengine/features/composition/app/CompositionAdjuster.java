package com.apelier.aiengine.features.composition.app;

import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import com.apelier.aiengine.features.analysis.domain.FaceBox;
import com.apelier.aiengine.features.composition.domain.CompositionResult;
import com.apelier.aiengine.features.composition.domain.CropRect;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Levels tilted horizons. A dominant near-horizontal line is found with Canny + probabilistic Hough;
 * if it is tilted by a correctable amount the image is rotated about its centre and cropped to the
 * largest upright rectangle that holds no rotation fill. A correction that would crop away the
 * centre of any detected face is not applied.
 * <p>
 * The input matrix is never modified.
 */
@Component
public class CompositionAdjuster {
    
    private static final Logger log = LoggerFactory.getLogger(CompositionAdjuster.class);
    
    static final double MIN_CORRECTION_DEGREES = 0.5;
    static final double MAX_CORRECTION_DEGREES = 10.0;
    private static final int DETECTION_DIMENSION = 1000;
    private static final int HOUGH_THRESHOLD = 100;
    private static final double MAX_LINE_GAP = 20;
    
    public CompositionAdjuster() {
        OpenCvNatives.ensureLoaded();
    }
    
    public CompositionResult adjust(Mat image, List<FaceBox> faces) {
        Double tilt = detectHorizonTilt(image);
        if (tilt == null || Math.abs(tilt) < MIN_CORRECTION_DEGREES || Math.abs(tilt) > MAX_CORRECTION_DEGREES) {
            return CompositionResult.unchanged(image.clone());
        }
        
        CropRect crop = inscribedCrop(image.cols(), image.rows(), tilt);
        if (crop.width() <= 0 || crop.height() <= 0) {
            return CompositionResult.unchanged(image.clone());
        }
        if (faces != null && !faces.stream().allMatch(face -> keepsFace(face, image, tilt, crop))) {
            log.debug("Skipping horizon correction of {} degrees, crop would cut a face", tilt);
            return CompositionResult.unchanged(image.clone());
        }
        
        Mat rotated = new Mat();
        Mat rotation = Imgproc.getRotationMatrix2D(center(image), tilt, 1.0);
        try {
            Imgproc.warpAffine(image, rotated, rotation, image.size(), Imgproc.INTER_CUBIC);
            Mat cropped = rotated.submat(new Rect(crop.x(), crop.y(), crop.width(), crop.height())).clone();
            double angle = Math.round(tilt * 100.0) / 100.0;
            log.debug("Levelled horizon by {} degrees, cropped to {}", angle, crop);
            return new CompositionResult(cropped, true, angle, true, crop);
        } finally {
            ImageMats.release(rotated, rotation);
        }
    }
    
    /**
     * Tilt in degrees of the dominant near-horizontal line, positive when the line falls to the right
     * in image coordinates, or null when no line is long enough.
     */
    Double detectHorizonTilt(Mat image) {
        Mat small = ImageMats.limitDimension(image, DETECTION_DIMENSION);
        Mat gray = ImageMats.toGray(small);
        Mat edges = new Mat();
        Mat lines = new Mat();
        try {
            Imgproc.Canny(gray, edges, 50, 150);
            double minLineLength = gray.cols() / 4.0;
            Imgproc.HoughLinesP(edges, lines, 1, Math.PI / 180, HOUGH_THRESHOLD, minLineLength, MAX_LINE_GAP);
            
            List<double[]> candidates = new ArrayList<>();
            for (int i = 0; i < lines.rows(); i++) {
                double[] line = lines.get(i, 0);
                double dx = line[2] - line[0];
                double dy = line[3] - line[1];
                if (dx < 0) {
                    dx = -dx;
                    dy = -dy;
                }
                double angle = Math.toDegrees(Math.atan2(dy, dx));
                if (Math.abs(angle) <= MAX_CORRECTION_DEGREES) {
                    candidates.add(new double[] {angle, Math.hypot(dx, dy)});
                }
            }
            return candidates.isEmpty() ? null : weightedMedian(candidates);
        } finally {
            ImageMats.release(small, gray, edges, lines);
        }
    }
    
    /**
     * Largest axis-aligned rectangle, centred, that fits inside a w x h image rotated by the given angle.
     */
    static CropRect inscribedCrop(int w, int h, double angleDegrees) {
        double angle = Math.toRadians(angleDegrees);
        boolean widthIsLonger = w >= h;
        double sideLong = widthIsLonger ? w : h;
        double sideShort = widthIsLonger ? h : w;
        double sin = Math.abs(Math.sin(angle));
        double cos = Math.abs(Math.cos(angle));
        
        double cropW;
        double cropH;
        if (sideShort <= 2.0 * sin * cos * sideLong || Math.abs(sin - cos) < 1e-10) {
            double x = 0.5 * sideShort;
            cropW = widthIsLonger ? x / sin : x / cos;
            cropH = widthIsLonger ? x / cos : x / sin;
        } else {
            double cos2a = cos * cos - sin * sin;
            cropW = (w * cos - h * sin) / cos2a;
            cropH = (h * cos - w * sin) / cos2a;
        }
        
        int width = (int) Math.floor(cropW);
        int height = (int) Math.floor(cropH);
        return new CropRect((w - width) / 2, (h - height) / 2, width, height);
    }
    
    private static boolean keepsFace(FaceBox face, Mat image, double tiltDegrees, CropRect crop) {
        Point c = center(image);
        double angle = Math.toRadians(tiltDegrees);
        double dx = face.centerX() - c.x;
        double dy = face.centerY() - c.y;
        // Same mapping as getRotationMatrix2D for a positive (counter-clockwise) angle
        double x = Math.cos(angle) * dx + Math.sin(angle) * dy + c.x;
        double y = -Math.sin(angle) * dx + Math.cos(angle) * dy + c.y;
        return x >= crop.x() && x < crop.x() + crop.width()
                && y >= crop.y() && y < crop.y() + crop.height();
    }
    
    private static Point center(Mat image) {
        return new Point(image.cols() / 2.0, image.rows() / 2.0);
    }
    
    private static double weightedMedian(List<double[]> anglesWithWeights) {
        anglesWithWeights.sort(Comparator.comparingDouble(entry -> entry[0]));
        double total = anglesWithWeights.stream().mapToDouble(entry -> entry[1]).sum();
        double running = 0;
        for (double[] entry : anglesWithWeights) {
            running += entry[1];
            if (running >= total / 2) {
                return entry[0];
            }
        }
        return anglesWithWeights.get(anglesWithWeights.size() - 1)[0];
    }
}
