package com.numera.backend.exceptions;

/**
 * The aggregator or processor API failed mid-run. The sync position is left untouched.
 */
public class UpstreamServiceException extends IngestionException {

    public UpstreamServiceException(String reason, String message, String diagnosticExcerpt, Throwable cause) {
        super(reason, message, diagnosticExcerpt, cause);
    }
}
