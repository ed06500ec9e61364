package com.apelier.aiengine.common.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the gallery pipeline.
 * Binds to app.pipeline.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {
    
    @NotBlank
    private String storageBucket = "photos";
    @Min(1)
    private int styleBatchSize = 20;
    private int styleJpegQuality = 95;
    private double retouchFidelity = 0.7;
    private int compositionJpegQuality = 95;
    private Tier full = new Tier(0, 88);
    private Tier web = new Tier(2048, 88);
    private Tier thumbnail = new Tier(400, 80);
    
    public String getStorageBucket() {
        return storageBucket;
    }
    
    public void setStorageBucket(String storageBucket) {
        this.storageBucket = storageBucket;
    }
    
    public int getStyleBatchSize() {
        return styleBatchSize;
    }
    
    public void setStyleBatchSize(int styleBatchSize) {
        this.styleBatchSize = styleBatchSize;
    }
    
    public int getStyleJpegQuality() {
        return styleJpegQuality;
    }
    
    public void setStyleJpegQuality(int styleJpegQuality) {
        this.styleJpegQuality = styleJpegQuality;
    }
    
    public double getRetouchFidelity() {
        return retouchFidelity;
    }
    
    public void setRetouchFidelity(double retouchFidelity) {
        this.retouchFidelity = retouchFidelity;
    }
    
    public int getCompositionJpegQuality() {
        return compositionJpegQuality;
    }
    
    public void setCompositionJpegQuality(int compositionJpegQuality) {
        this.compositionJpegQuality = compositionJpegQuality;
    }
    
    public Tier getFull() {
        return full;
    }
    
    public void setFull(Tier full) {
        this.full = full;
    }
    
    public Tier getWeb() {
        return web;
    }
    
    public void setWeb(Tier web) {
        this.web = web;
    }
    
    public Tier getThumbnail() {
        return thumbnail;
    }
    
    public void setThumbnail(Tier thumbnail) {
        this.thumbnail = thumbnail;
    }
    
    /**
     * One output encoding tier. A max dimension of 0 keeps the source resolution.
     */
    public static class Tier {
        
        private int maxPx;
        private int jpegQuality;
        
        public Tier() {
        }
        
        public Tier(int maxPx, int jpegQuality) {
            this.maxPx = maxPx;
            this.jpegQuality = jpegQuality;
        }
        
        public int getMaxPx() {
            return maxPx;
        }
        
        public void setMaxPx(int maxPx) {
            this.maxPx = maxPx;
        }
        
        public int getJpegQuality() {
            return jpegQuality;
        }
        
        public void setJpegQuality(int jpegQuality) {
            this.jpegQuality = jpegQuality;
        }
    }
}
