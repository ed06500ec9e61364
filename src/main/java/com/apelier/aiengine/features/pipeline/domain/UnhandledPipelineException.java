package com.apelier.aiengine.features.pipeline.domain;

import com.apelier.aiengine.features.gallery.domain.PipelinePhase;

/**
 * Wraps an exception that escaped a phase. Carries the cause's message so the job's error log shows the original text.
 */
public class UnhandledPipelineException extends PipelineException {
    
    private final PipelinePhase phase;
    
    public UnhandledPipelineException(PipelinePhase phase, Throwable cause) {
        super(describe(cause), cause);
        this.phase = phase;
    }
    
    public UnhandledPipelineException(Throwable cause) {
        this(null, cause);
    }
    
    /**
     * Phase the exception escaped from, or null when it was raised outside any phase.
     */
    public PipelinePhase getPhase() {
        return phase;
    }
    
    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
