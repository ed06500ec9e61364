package com.apelier.aiengine.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for per-image analysis.
 * Binds to app.analysis.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.analysis")
public class AnalysisProperties {
    
    /**
     * Optional filesystem path of a Haar cascade for frontal face detection. When empty or unreadable the
     * haarcascade_frontalface_default.xml bundled on the classpath is used.
     */
    private String faceCascadePath;
    private int maxAnalysisDimension = 1600;
    private int duplicateThreshold = 10;
    
    public String getFaceCascadePath() {
        return faceCascadePath;
    }
    
    public void setFaceCascadePath(String faceCascadePath) {
        this.faceCascadePath = faceCascadePath;
    }
    
    public int getMaxAnalysisDimension() {
        return maxAnalysisDimension;
    }
    
    public void setMaxAnalysisDimension(int maxAnalysisDimension) {
        this.maxAnalysisDimension = maxAnalysisDimension;
    }
    
    public int getDuplicateThreshold() {
        return duplicateThreshold;
    }
    
    public void setDuplicateThreshold(int duplicateThreshold) {
        this.duplicateThreshold = duplicateThreshold;
    }
}
