package com.apelier.aiengine.features.gallery.domain;

public enum ProcessingStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;
    
    public String value() {
        return name().toLowerCase();
    }
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
    
    public static ProcessingStatus fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
