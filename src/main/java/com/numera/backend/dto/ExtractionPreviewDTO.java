package com.numera.backend.dto;

import java.util.List;

import com.numera.backend.enums.IngestionSource;
import com.numera.backend.services.extraction.ExtractionBatch;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ExtractionPreviewDTO {

    private IngestionSource source;
    private List<CandidateTransactionDTO> transactions;
    private List<ExtractedAccountDTO> accounts;
    private int droppedRecords;

    public static ExtractionPreviewDTO from(IngestionSource source, ExtractionBatch batch) {
        return new ExtractionPreviewDTO(
                source,
                batch.transactions().stream().map(CandidateTransactionDTO::from).toList(),
                batch.accounts().stream().map(ExtractedAccountDTO::from).toList(),
                batch.droppedRecords()
        );
    }
}
