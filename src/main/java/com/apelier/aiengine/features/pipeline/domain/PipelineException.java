package com.apelier.aiengine.features.pipeline.domain;

/**
 * A failure that ends a pipeline run. The message becomes the processing job's error log.
 */
public class PipelineException extends RuntimeException {
    
    public PipelineException(String message) {
        super(message);
    }
    
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
