package com.apelier.aiengine.features.gpu.domain;

public record GpuHealth(String status) {
    
    public static final String OK = "ok";
    
    public static GpuHealth unavailable() {
        return new GpuHealth(GpuCallStatus.UNAVAILABLE);
    }
    
    public boolean isNominal() {
        return OK.equals(status);
    }
}
