package com.apelier.aiengine.features.analysis.domain;

public enum SceneType {
    PORTRAIT("portrait"),
    GROUP("group"),
    LANDSCAPE("landscape"),
    DETAIL("detail"),
    CEREMONY("ceremony"),
    RECEPTION("reception"),
    CANDID("candid");
    
    private final String value;
    
    SceneType(String value) {
        this.value = value;
    }
    
    /**
     * Lower-case name stored on the photo record.
     */
    public String value() {
        return value;
    }
}
