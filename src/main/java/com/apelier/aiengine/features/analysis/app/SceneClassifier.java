package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import com.apelier.aiengine.features.analysis.domain.SceneType;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

/**
 * Rule-based scene classification from face count, aspect ratio, edge density and HSV statistics.
 * Rules are evaluated in order and the first match wins.
 */
@Component
public class SceneClassifier {
    
    static final double LANDSCAPE_ASPECT = 1.5;
    static final double LANDSCAPE_GREEN_RATIO = 1.05;
    static final double DETAIL_EDGE_DENSITY = 0.15;
    static final double RECEPTION_MAX_BRIGHTNESS = 100;
    static final double RECEPTION_MIN_SATURATION = 60;
    static final double CROWD_RECEPTION_MAX_BRIGHTNESS = 120;
    
    /**
     * Image statistics the rules look at. Brightness and saturation are HSV means on a 0..255 scale;
     * green ratio is the mean green channel over the mean of all channels.
     */
    public record SceneFeatures(
        double aspectRatio,
        double edgeDensity,
        double meanSaturation,
        double meanBrightness,
        double greenRatio
    ) {
    }
    
    public SceneClassifier() {
        OpenCvNatives.ensureLoaded();
    }
    
    public SceneType classify(Mat image, int faceCount) {
        return classify(measure(image), faceCount);
    }
    
    public static SceneType classify(SceneFeatures features, int faceCount) {
        if (faceCount == 0) {
            if (features.aspectRatio() > LANDSCAPE_ASPECT && features.greenRatio() > LANDSCAPE_GREEN_RATIO) {
                return SceneType.LANDSCAPE;
            }
            if (features.edgeDensity() > DETAIL_EDGE_DENSITY) {
                return SceneType.DETAIL;
            }
            if (features.meanBrightness() < RECEPTION_MAX_BRIGHTNESS
                    && features.meanSaturation() > RECEPTION_MIN_SATURATION) {
                return SceneType.RECEPTION;
            }
            return SceneType.LANDSCAPE;
        }
        if (faceCount <= 2) {
            return SceneType.PORTRAIT;
        }
        if (faceCount <= 6) {
            return SceneType.GROUP;
        }
        // Large crowds are usually a ceremony, or a reception once the lights go down
        return features.meanBrightness() < CROWD_RECEPTION_MAX_BRIGHTNESS
                ? SceneType.RECEPTION
                : SceneType.CEREMONY;
    }
    
    public SceneFeatures measure(Mat image) {
        double aspect = (double) image.cols() / image.rows();
        
        Mat gray = ImageMats.toGray(image);
        Mat edges = new Mat();
        Mat hsv = new Mat();
        try {
            Imgproc.Canny(gray, edges, 50, 150);
            double edgeDensity = (double) Core.countNonZero(edges) / edges.total();
            
            if (image.channels() < 3) {
                return new SceneFeatures(aspect, edgeDensity, 0, Core.mean(gray).val[0], 1.0);
            }
            
            Imgproc.cvtColor(image, hsv, Imgproc.COLOR_BGR2HSV);
            Scalar hsvMean = Core.mean(hsv);
            Scalar bgrMean = Core.mean(image);
            double overallMean = (bgrMean.val[0] + bgrMean.val[1] + bgrMean.val[2]) / 3.0;
            double greenRatio = bgrMean.val[1] / (overallMean + 1e-6);
            
            return new SceneFeatures(aspect, edgeDensity, hsvMean.val[1], hsvMean.val[2], greenRatio);
        } finally {
            ImageMats.release(gray, edges, hsv);
        }
    }
}
