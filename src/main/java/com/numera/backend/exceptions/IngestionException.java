package com.numera.backend.exceptions;

/**
 * Root of the ingestion failure taxonomy.
 *
 * {@link #getReason()} is a stable machine-readable code ("document-not-viable",
 * "unparseable-response", ...). {@link #getDiagnosticExcerpt()} holds a bounded slice of the
 * offending payload for server-side logs only; it is never sent back to the caller.
 */
public abstract class IngestionException extends RuntimeException {

    public static final int MAX_EXCERPT_CHARS = 300;

    private final String reason;
    private final String diagnosticExcerpt;

    protected IngestionException(String reason, String message) {
        this(reason, message, null, null);
    }

    protected IngestionException(String reason, String message, String diagnosticExcerpt, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.diagnosticExcerpt = excerpt(diagnosticExcerpt);
    }

    public String getReason() {
        return reason;
    }

    public String getDiagnosticExcerpt() {
        return diagnosticExcerpt;
    }

    public static String excerpt(String payload) {
        if (payload == null) return null;
        String s = payload.replaceAll("\\s+", " ").trim();
        if (s.length() <= MAX_EXCERPT_CHARS) return s;
        return s.substring(0, MAX_EXCERPT_CHARS) + "...";
    }
}
