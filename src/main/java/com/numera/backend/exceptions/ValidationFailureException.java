package com.numera.backend.exceptions;

/**
 * Well-formed JSON in which no record passed schema validation.
 */
public class ValidationFailureException extends ExtractionFailureException {

    public static final String NO_USABLE_RECORDS = "no-usable-records";

    public ValidationFailureException(String message, String diagnosticExcerpt) {
        super(NO_USABLE_RECORDS, message, diagnosticExcerpt);
    }
}
