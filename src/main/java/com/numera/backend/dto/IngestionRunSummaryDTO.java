package com.numera.backend.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one ingestion run. {@code errors} holds one short reason per record that was
 * not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionRunSummaryDTO {

    private boolean success;
    private int count;
    private int skipped;
    private List<String> errors;
    private int accountsCreated;
    private int accountsUpdated;
}
