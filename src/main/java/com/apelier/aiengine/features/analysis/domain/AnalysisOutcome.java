package com.apelier.aiengine.features.analysis.domain;

import java.util.Optional;

/**
 * Result of analysing one image: either an {@link AnalysisResult} or the reason it could not be produced.
 * Decode failures are reported here rather than thrown, callers treat them as a skip signal.
 */
public final class AnalysisOutcome {
    
    private final AnalysisResult result;
    private final String error;
    
    private AnalysisOutcome(AnalysisResult result, String error) {
        this.result = result;
        this.error = error;
    }
    
    public static AnalysisOutcome success(AnalysisResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Result cannot be null");
        }
        return new AnalysisOutcome(result, null);
    }
    
    public static AnalysisOutcome failure(String error) {
        return new AnalysisOutcome(null, error);
    }
    
    public boolean isSuccess() {
        return result != null;
    }
    
    public Optional<AnalysisResult> result() {
        return Optional.ofNullable(result);
    }
    
    public String error() {
        return error;
    }
}
