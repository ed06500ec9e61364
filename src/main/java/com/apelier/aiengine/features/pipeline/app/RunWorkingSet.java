package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.analysis.domain.AnalysisResult;
import org.opencv.core.Mat;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Transient per-photo data for one run, keyed by photo id: downloaded original bytes, analysis results
 * and the image produced by the composition phase. Nothing here is persisted. {@link #close()} releases
 * native buffers and must run at the end of every run.
 */
public class RunWorkingSet implements AutoCloseable {
    
    private final Map<String, byte[]> originals = new HashMap<>();
    private final Map<String, AnalysisResult> analyses = new HashMap<>();
    private final Map<String, Mat> processed = new HashMap<>();
    private boolean closed;
    
    public void putOriginal(String photoId, byte[] bytes) {
        ensureOpen();
        originals.put(photoId, bytes);
    }
    
    public Optional<byte[]> original(String photoId) {
        return Optional.ofNullable(originals.get(photoId));
    }
    
    public void putAnalysis(String photoId, AnalysisResult result) {
        ensureOpen();
        analyses.put(photoId, result);
    }
    
    public Optional<AnalysisResult> analysis(String photoId) {
        return Optional.ofNullable(analyses.get(photoId));
    }
    
    public Map<String, AnalysisResult> analyses() {
        return Map.copyOf(analyses);
    }
    
    /**
     * Take ownership of a processed image, releasing any image previously cached for the photo.
     */
    public void putProcessed(String photoId, Mat image) {
        ensureOpen();
        Mat previous = processed.put(photoId, image);
        if (previous != null && previous != image) {
            previous.release();
        }
    }
    
    public Optional<Mat> processed(String photoId) {
        return Optional.ofNullable(processed.get(photoId));
    }
    
    /**
     * Drop everything cached for one photo once no later phase needs it.
     */
    public void evict(String photoId) {
        originals.remove(photoId);
        Mat image = processed.remove(photoId);
        if (image != null) {
            image.release();
        }
    }
    
    public boolean isEmpty() {
        return originals.isEmpty() && analyses.isEmpty() && processed.isEmpty();
    }
    
    public boolean isClosed() {
        return closed;
    }
    
    @Override
    public void close() {
        processed.values().forEach(Mat::release);
        processed.clear();
        originals.clear();
        analyses.clear();
        closed = true;
    }
    
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Working set already closed");
        }
    }
}
