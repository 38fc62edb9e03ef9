package com.numera.backend.exceptions;

/**
 * Raised when a source yields nothing usable: document without a text layer, model call
 * failed or timed out, or a response that survived none of the repair stages.
 */
public class ExtractionFailureException extends IngestionException {

    public ExtractionFailureException(String reason, String message) {
        super(reason, message);
    }

    public ExtractionFailureException(String reason, String message, String diagnosticExcerpt) {
        super(reason, message, diagnosticExcerpt, null);
    }

    public ExtractionFailureException(String reason, String message, Throwable cause) {
        super(reason, message, null, cause);
    }
}
