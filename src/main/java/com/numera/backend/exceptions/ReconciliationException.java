package com.numera.backend.exceptions;

/**
 * Persistence of a single record failed. Recovered per record by the reconciler and
 * reported only as an entry of the run summary.
 */
public class ReconciliationException extends IngestionException {

    public ReconciliationException(String message, Throwable cause) {
        super("record-not-persisted", message, null, cause);
    }
}
