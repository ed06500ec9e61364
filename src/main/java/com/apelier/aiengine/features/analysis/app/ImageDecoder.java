package com.apelier.aiengine.features.analysis.app;

import com.apelier.aiengine.common.imaging.ImageMats;
import com.apelier.aiengine.common.imaging.OpenCvNatives;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * Decodes image bytes to an 8-bit BGR matrix.
 * Tries, in order: the OpenCV codecs, Java ImageIO, then the embedded preview of a camera-raw file.
 * The caller owns the returned matrix and must release it.
 */
@Component
public class ImageDecoder {
    
    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);
    
    private final RawPreviewExtractor rawPreviewExtractor = new RawPreviewExtractor();
    
    public ImageDecoder() {
        OpenCvNatives.ensureLoaded();
    }
    
    public Optional<Mat> decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        
        Optional<Mat> decoded = decodeWithOpenCv(bytes);
        if (decoded.isPresent()) {
            return decoded;
        }
        
        log.debug("OpenCV could not decode {} bytes, trying ImageIO", bytes.length);
        decoded = decodeWithImageIo(bytes);
        if (decoded.isPresent()) {
            return decoded;
        }
        
        log.debug("ImageIO could not decode {} bytes, trying embedded raw preview", bytes.length);
        decoded = rawPreviewExtractor.extract(bytes);
        if (decoded.isEmpty()) {
            log.warn("Failed to decode image ({} bytes) with OpenCV, ImageIO or raw preview", bytes.length);
        }
        return decoded;
    }
    
    private Optional<Mat> decodeWithOpenCv(byte[] bytes) {
        MatOfByte encoded = new MatOfByte(bytes);
        try {
            Mat mat = Imgcodecs.imdecode(encoded, Imgcodecs.IMREAD_COLOR);
            if (mat.empty()) {
                mat.release();
                return Optional.empty();
            }
            return Optional.of(mat);
        } finally {
            encoded.release();
        }
    }
    
    private Optional<Mat> decodeWithImageIo(byte[] bytes) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                return Optional.empty();
            }
            return Optional.of(ImageMats.fromBufferedImage(image));
        } catch (IOException e) {
            log.debug("ImageIO decode failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
