package com.example.rota.exception;

public class ValidationException extends BusinessException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(String errorCode, String message) {
        super(errorCode, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(String message, String field, Object rejectedValue) {
        super("VALIDATION_ERROR", message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
