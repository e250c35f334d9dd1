package com.example.rota.exception;

/**
 * Root of the typed failures raised by state transitions.
 * Each subclass maps to one HTTP status in {@link GlobalExceptionHandler}.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
    }

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
