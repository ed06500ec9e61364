package com.apelier.aiengine.features.gpu.domain;

public interface GpuClientFactory {
    
    GpuClient open();
}
