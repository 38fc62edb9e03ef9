package com.numera.backend.dto;

import java.util.List;
import java.util.UUID;

import com.numera.backend.enums.IngestionSource;

import jakarta.validation.constraints.NotNull;

/**
 * User-confirmed extraction result. {@code accountId} overrides the account derived from the
 * extracted balances.
 */
public record ImportConfirmRequestDTO(

        @NotNull(message = "source is required")
        IngestionSource source,

        UUID accountId,

        List<CandidateTransactionDTO> transactions,

        List<ExtractedAccountDTO> accounts
) {
    public List<CandidateTransactionDTO> transactionsOrEmpty() {
        return transactions == null ? List.of() : transactions;
    }

    public List<ExtractedAccountDTO> accountsOrEmpty() {
        return accounts == null ? List.of() : accounts;
    }
}
