package com.example.rota.exception;

/**
 * The request raced another transition or hit a uniqueness rule.
 * Callers retry with fresh state.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message) {
        super("CONFLICT", message);
    }

    public ConflictException(String errorCode, String message) {
        super(errorCode, message);
    }
}
