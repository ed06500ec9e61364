package com.apelier.aiengine.features.gallery.domain;

/**
 * Values of {@code processing_jobs.current_phase}. The six processing phases run in declaration order
 * between {@link #QUEUED} and {@link #COMPLETE}.
 */
public enum PipelinePhase {
    QUEUED,
    ANALYSIS,
    STYLE,
    RETOUCH,
    CLEANUP,
    COMPOSITION,
    OUTPUT,
    COMPLETE;
    
    public String value() {
        return name().toLowerCase();
    }
    
    public static PipelinePhase fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
