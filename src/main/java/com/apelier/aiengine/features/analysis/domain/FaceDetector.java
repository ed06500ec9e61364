package com.apelier.aiengine.features.analysis.domain;

import org.opencv.core.Mat;

import java.util.List;

/**
 * Finds faces in a BGR image. Boxes are returned in the coordinates of the image passed in.
 */
public interface FaceDetector {
    
    List<FaceBox> detect(Mat image);
}
