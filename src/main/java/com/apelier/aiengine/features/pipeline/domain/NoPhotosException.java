package com.apelier.aiengine.features.pipeline.domain;

public class NoPhotosException extends PipelineException {
    
    public static final String MESSAGE = "No photos found";
    
    public NoPhotosException() {
        super(MESSAGE);
    }
}
