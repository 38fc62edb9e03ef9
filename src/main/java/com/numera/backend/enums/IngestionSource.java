package com.numera.backend.enums;

/**
 * Where a ledger row came from.
 */
public enum IngestionSource {
    DOCUMENT,
    SPREADSHEET,
    AGGREGATOR,
    PROCESSOR
}
