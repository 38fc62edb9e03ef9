package com.numera.backend.exceptions;

public class AuthorizationException extends IngestionException {

    public AuthorizationException(String message) {
        super("not-authorized", message);
    }
}
