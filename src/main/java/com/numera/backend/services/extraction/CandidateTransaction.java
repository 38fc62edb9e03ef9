package com.numera.backend.services.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.numera.backend.enums.TransactionCategory;

/**
 * Schema-valid transaction pulled out of a statement. Amount is signed: negative is an outflow.
 */
public record CandidateTransaction(
        LocalDate date,
        String description,
        BigDecimal amount,
        TransactionCategory category
) {
}
