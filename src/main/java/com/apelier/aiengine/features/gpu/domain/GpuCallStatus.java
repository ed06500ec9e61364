package com.apelier.aiengine.features.gpu.domain;

/**
 * Status strings returned by the GPU service.
 */
public final class GpuCallStatus {
    
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String UNAVAILABLE = "unavailable";
    
    private GpuCallStatus() {
    }
}
