package com.apelier.aiengine.features.gallery.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.util.Optional;

@Entity
@Table(name = "style_profiles")
public class StyleProfile {
    
    @Id
    private String id;
    
    @Column(name = "photographer_id")
    private String photographerId;
    
    @Column(name = "model_key")
    private String modelKey;
    
    @Column(name = "model_weights_key")
    private String modelWeightsKey;
    
    @Column
    private String status;
    
    protected StyleProfile() {
        // JPA constructor
    }
    
    public StyleProfile(String id, String photographerId, String modelKey, String status) {
        this.id = id;
        this.photographerId = photographerId;
        this.modelKey = modelKey;
        this.status = status;
    }
    
    /**
     * File name of the trained model, e.g. {@code abc.pth} for {@code models/{photographer}/abc.pth}.
     * Empty when the profile was never trained.
     */
    public Optional<String> modelFilename() {
        String key = modelKey != null && !modelKey.isBlank() ? modelKey : modelWeightsKey;
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(key.substring(key.lastIndexOf('/') + 1));
    }
    
    public String getId() { return id; }
    public String getPhotographerId() { return photographerId; }
    public String getModelKey() { return modelKey; }
    public String getModelWeightsKey() { return modelWeightsKey; }
    public String getStatus() { return status; }
}
