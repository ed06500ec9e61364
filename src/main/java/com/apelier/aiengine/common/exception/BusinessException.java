package com.apelier.aiengine.common.exception;

/**
 * Rule violation with a stable machine-readable code.
 */
public class BusinessException extends RuntimeException {
    
    private final String code;
    
    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
}
