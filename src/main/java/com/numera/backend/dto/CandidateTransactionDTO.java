package com.numera.backend.dto;

import java.math.BigDecimal;

import com.numera.backend.services.extraction.CandidateTransaction;

/**
 * Extracted transaction as shown to the user for confirmation and sent back on import.
 * Fields stay loosely typed: the import re-validates them.
 */
public record CandidateTransactionDTO(
        String date,
        String description,
        BigDecimal amount,
        String category
) {
    public static CandidateTransactionDTO from(CandidateTransaction candidate) {
        return new CandidateTransactionDTO(
                candidate.date().toString(),
                candidate.description(),
                candidate.amount(),
                candidate.category().name()
        );
    }
}
