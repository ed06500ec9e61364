package com.apelier.aiengine.features.pipeline.domain;

public class MissingPhotographerException extends PipelineException {
    
    public static final String MESSAGE = "Missing photographer_id";
    
    public MissingPhotographerException() {
        super(MESSAGE);
    }
}
