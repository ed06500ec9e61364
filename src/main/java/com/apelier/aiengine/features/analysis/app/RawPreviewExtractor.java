package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.imaging.ImageMats;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;

import java.util.Arrays;
import java.util.Optional;

/**
 * Decodes camera-raw files (CR2, NEF, ARW, DNG, ...) through the JPEG previews they embed.
 * Every JPEG start-of-image marker is a candidate; the candidate that decodes to the
 * largest image is the full-size preview.
 */
class RawPreviewExtractor {
    
    private static final int MAX_CANDIDATES = 16;
    
    Optional<Mat> extract(byte[] bytes) {
        Mat best = null;
        int candidates = 0;
        
        for (int i = 0; i + 2 < bytes.length && candidates < MAX_CANDIDATES; i++) {
            if (!isStartOfImage(bytes, i)) {
                continue;
            }
            candidates++;
            
            // The decoder stops at the first end-of-image marker, trailing bytes are ignored
            MatOfByte encoded = new MatOfByte(Arrays.copyOfRange(bytes, i, bytes.length));
            Mat decoded = Imgcodecs.imdecode(encoded, Imgcodecs.IMREAD_COLOR);
            encoded.release();
            
            if (decoded.empty()) {
                decoded.release();
                continue;
            }
            if (best == null || area(decoded) > area(best)) {
                ImageMats.release(best);
                best = decoded;
            } else {
                decoded.release();
            }
        }
        return Optional.ofNullable(best);
    }
    
    private static boolean isStartOfImage(byte[] bytes, int i) {
        return (bytes[i] & 0xFF) == 0xFF
                && (bytes[i + 1] & 0xFF) == 0xD8
                && (bytes[i + 2] & 0xFF) == 0xFF;
    }
    
    private static long area(Mat mat) {
        return (long) mat.rows() * mat.cols();
    }
}
