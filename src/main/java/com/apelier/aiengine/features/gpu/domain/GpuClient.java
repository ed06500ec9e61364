package com.apelier.aiengine.features.gpu.domain;

import com.apelier.aiengine.features.gallery.domain.DetectedFace;

import java.util.List;

/**
 * Session with the remote GPU compute service, opened once per pipeline run.
 * <p>
 * Calls never throw for transport or service failures: they return a result whose status is
 * {@code error} or {@code unavailable}. After {@link #close()} every call reports unavailable.
 */
public interface GpuClient extends AutoCloseable {
    
    /**
     * False when no service endpoint is configured; callers skip the health probe and every GPU phase.
     */
    boolean isConfigured();
    
    GpuHealth health();
    
    /**
     * Style a batch of images with a trained model. Input and output keys are object-store keys.
     */
    StyleBatchResult applyStyleBatch(List<StyleBatchItem> images, String modelFilename, int jpegQuality);
    
    FaceRetouchResult faceRetouch(String imageKey, String outputKey, double fidelity, List<DetectedFace> faceData);
    
    SceneCleanupResult sceneCleanup(String imageKey, String outputKey, List<String> detections);
    
    @Override
    void close();
}
