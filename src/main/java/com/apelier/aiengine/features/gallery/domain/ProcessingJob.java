package com.apelier.aiengine.features.gallery.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Progress record of one pipeline run, polled by the front end.
 * <p>
 * {@code processedImages} never exceeds {@code totalImages}, never decreases within a phase
 * and is reset to 0 when a phase begins.
 */
@Entity
@Table(name = "processing_jobs")
public class ProcessingJob {
    
    @Id
    private String id;
    
    @Column(name = "gallery_id", nullable = false)
    private String galleryId;
    
    @Column(name = "photographer_id")
    private String photographerId;
    
    @Column(name = "style_profile_id")
    private String styleProfileId;
    
    @Column(name = "total_images", nullable = false)
    private int totalImages;
    
    @Column(name = "processed_images", nullable = false)
    private int processedImages;
    
    @Convert(converter = PipelinePhaseConverter.class)
    @Column(name = "current_phase", nullable = false)
    private PipelinePhase currentPhase;
    
    @Convert(converter = ProcessingStatusConverter.class)
    @Column(nullable = false)
    private ProcessingStatus status;
    
    @Column(name = "error_log", columnDefinition = "text")
    private String errorLog;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "started_at")
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    protected ProcessingJob() {
        // JPA constructor
    }
    
    public ProcessingJob(String id, String galleryId, String photographerId, String styleProfileId, int totalImages) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Processing job ID cannot be blank");
        }
        if (totalImages < 0) {
            throw new IllegalArgumentException("Total images cannot be negative");
        }
        this.id = id;
        this.galleryId = galleryId;
        this.photographerId = photographerId;
        this.styleProfileId = styleProfileId;
        this.totalImages = totalImages;
        this.processedImages = 0;
        this.currentPhase = PipelinePhase.QUEUED;
        this.status = ProcessingStatus.QUEUED;
        this.createdAt = Instant.now();
    }
    
    /**
     * Start a phase: progress goes back to 0 and the job is marked processing.
     */
    public void enterPhase(PipelinePhase phase, int totalImages) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status.value());
        }
        if (startedAt == null) {
            this.startedAt = Instant.now();
        }
        this.totalImages = totalImages;
        this.currentPhase = phase;
        this.processedImages = 0;
        this.status = ProcessingStatus.PROCESSING;
    }
    
    public void recordProgress(int processed) {
        int bounded = Math.min(processed, totalImages);
        if (bounded > processedImages) {
            this.processedImages = bounded;
        }
    }
    
    public void completePhase() {
        this.processedImages = totalImages;
    }
    
    public void markCompleted() {
        this.processedImages = totalImages;
        this.status = ProcessingStatus.COMPLETED;
        this.completedAt = Instant.now();
    }
    
    public void markFailed(String error) {
        this.status = ProcessingStatus.FAILED;
        this.errorLog = error;
        this.completedAt = Instant.now();
    }
    
    public String getId() { return id; }
    public String getGalleryId() { return galleryId; }
    public String getPhotographerId() { return photographerId; }
    public String getStyleProfileId() { return styleProfileId; }
    public int getTotalImages() { return totalImages; }
    public int getProcessedImages() { return processedImages; }
    public PipelinePhase getCurrentPhase() { return currentPhase; }
    public ProcessingStatus getStatus() { return status; }
    public String getErrorLog() { return errorLog; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
}
