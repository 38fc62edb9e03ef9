package com.numera.backend.enums;

public enum IngestionOutcome {
    PREVIEWED,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    REJECTED,
    FAILED
}
