package com.numera.backend.services.extraction;

import java.util.List;

/**
 * Output of the repair and validation pipeline for one model response.
 *
 * @param droppedRecords objects that parsed but failed classification or validation
 * @param repairStage    name of the stage that produced a parse
 */
public record ExtractionBatch(
        List<CandidateTransaction> transactions,
        List<ExtractedAccount> accounts,
        int droppedRecords,
        String repairStage
) {
    public ExtractionBatch {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public boolean isEmpty() {
        return transactions.isEmpty() && accounts.isEmpty();
    }
}
