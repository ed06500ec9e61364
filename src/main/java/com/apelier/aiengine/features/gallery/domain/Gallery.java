package com.apelier.aiengine.features.gallery.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "galleries")
public class Gallery {
    
    @Id
    private String id;
    
    @Column(name = "photographer_id")
    private String photographerId;
    
    @Column(name = "job_id")
    private String jobId;
    
    @Column
    private String status;
    
    protected Gallery() {
        // JPA constructor
    }
    
    public Gallery(String id, String photographerId, String jobId) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Gallery ID cannot be blank");
        }
        this.id = id;
        this.photographerId = photographerId;
        this.jobId = jobId;
        this.status = GalleryStatus.GALLERY_PROCESSING;
    }
    
    public void markReady() {
        this.status = GalleryStatus.GALLERY_READY;
    }
    
    public String getId() { return id; }
    public String getPhotographerId() { return photographerId; }
    public String getJobId() { return jobId; }
    public String getStatus() { return status; }
}
