package com.apelier.aiengine.common.imaging;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Conversions between OpenCV BGR matrices, {@link BufferedImage} and encoded bytes.
 */
public final class ImageMats {
    
    private ImageMats() {
    }
    
    /**
     * Copy a BGR (or single-channel) 8-bit matrix into a new {@link BufferedImage}.
     */
    public static BufferedImage toBufferedImage(Mat mat) {
        Mat source = mat.isContinuous() ? mat : mat.clone();
        try {
            int type = source.channels() == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR;
            BufferedImage image = new BufferedImage(source.cols(), source.rows(), type);
            byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            source.get(0, 0, target);
            return image;
        } finally {
            if (source != mat) {
                source.release();
            }
        }
    }
    
    /**
     * Copy any {@link BufferedImage} into a new 8-bit BGR matrix.
     */
    public static Mat fromBufferedImage(BufferedImage image) {
        BufferedImage bgr = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            bgr = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = bgr.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }
        byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(bgr.getHeight(), bgr.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }
    
    /**
     * Encode a BGR matrix as JPEG at the given quality (0-100).
     */
    public static byte[] encodeJpeg(Mat mat, int quality) {
        MatOfByte buffer = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        try {
            if (!Imgcodecs.imencode(".jpg", mat, buffer, params)) {
                throw new IllegalStateException("JPEG encoding failed");
            }
            return buffer.toArray();
        } finally {
            buffer.release();
            params.release();
        }
    }
    
    /**
     * Return a copy whose longest side is at most {@code maxDimension}, using area interpolation.
     * Smaller images are returned as a plain copy.
     */
    public static Mat limitDimension(Mat mat, int maxDimension) {
        int longest = Math.max(mat.rows(), mat.cols());
        if (longest <= maxDimension) {
            return mat.clone();
        }
        double scale = (double) maxDimension / longest;
        Mat resized = new Mat();
        Imgproc.resize(mat, resized,
                new Size((int) (mat.cols() * scale), (int) (mat.rows() * scale)),
                0, 0, Imgproc.INTER_AREA);
        return resized;
    }
    
    /**
     * Single-channel grayscale copy of a BGR or grayscale matrix.
     */
    public static Mat toGray(Mat mat) {
        Mat gray = new Mat();
        if (mat.channels() == 1) {
            mat.copyTo(gray);
        } else {
            Imgproc.cvtColor(mat, gray, Imgproc.COLOR_BGR2GRAY);
        }
        return gray;
    }
    
    public static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
    }
}
