package com.example.rota.exception;

public class AuthorizationException extends BusinessException {

    public AuthorizationException(String message) {
        super("FORBIDDEN", message);
    }
}
