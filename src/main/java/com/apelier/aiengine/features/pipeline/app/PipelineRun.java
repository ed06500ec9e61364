package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.features.gallery.domain.Photo;
import com.apelier.aiengine.features.gpu.domain.GpuClient;
import com.apelier.aiengine.features.pipeline.domain.PipelineRequest;

import java.util.List;
import java.util.Optional;

/**
 * State shared by the phases of one run, built once the preflight checks have passed.
 */
public class PipelineRun {
    
    private final PipelineRequest request;
    private final String photographerId;
    private final String jobId;
    private final GpuClient gpuClient;
    private final boolean gpuAvailable;
    private final String modelFilename;
    private final List<Photo> photos;
    private final RunWorkingSet workingSet;
    private final PhaseProgressTracker progress;
    
    public PipelineRun(
            PipelineRequest request,
            String photographerId,
            String jobId,
            GpuClient gpuClient,
            boolean gpuAvailable,
            String modelFilename,
            List<Photo> photos,
            RunWorkingSet workingSet,
            PhaseProgressTracker progress) {
        this.request = request;
        this.photographerId = photographerId;
        this.jobId = jobId;
        this.gpuClient = gpuClient;
        this.gpuAvailable = gpuAvailable;
        this.modelFilename = modelFilename;
        this.photos = List.copyOf(photos);
        this.workingSet = workingSet;
        this.progress = progress;
    }
    
    public String galleryId() {
        return request.galleryId();
    }
    
    public PipelineRequest request() {
        return request;
    }
    
    public String photographerId() {
        return photographerId;
    }
    
    public Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }
    
    public GpuClient gpu() {
        return gpuClient;
    }
    
    public boolean isGpuAvailable() {
        return gpuAvailable;
    }
    
    public Optional<String> modelFilename() {
        return Optional.ofNullable(modelFilename);
    }
    
    /**
     * True when a trained style model was resolved for this run.
     */
    public boolean hasStyle() {
        return modelFilename != null;
    }
    
    public List<Photo> photos() {
        return photos;
    }
    
    public int totalPhotos() {
        return photos.size();
    }
    
    public RunWorkingSet workingSet() {
        return workingSet;
    }
    
    public PhaseProgressTracker progress() {
        return progress;
    }
}
