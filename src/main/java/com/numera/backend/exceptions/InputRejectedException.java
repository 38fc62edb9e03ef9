package com.numera.backend.exceptions;

/**
 * Input refused before any parsing: bad mime type, oversized, empty, protected.
 */
public class InputRejectedException extends IngestionException {

    public InputRejectedException(String reason, String message) {
        super(reason, message);
    }
}
