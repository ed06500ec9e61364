package com.apelier.aiengine.features.gallery.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * The photographer's booking a gallery was shot for. Only its status is touched here.
 */
@Entity
@Table(name = "jobs")
public class ShootJob {
    
    @Id
    private String id;
    
    @Column
    private String status;
    
    protected ShootJob() {
        // JPA constructor
    }
    
    public ShootJob(String id, String status) {
        this.id = id;
        this.status = status;
    }
    
    public void markReadyForReview() {
        this.status = GalleryStatus.JOB_READY_FOR_REVIEW;
    }
    
    public String getId() { return id; }
    public String getStatus() { return status; }
}
