package com.numera.backend.dto;

import java.math.BigDecimal;

import com.numera.backend.services.extraction.ExtractedAccount;

public record ExtractedAccountDTO(
        String name,
        BigDecimal balance,
        String currency
) {
    public static ExtractedAccountDTO from(ExtractedAccount account) {
        return new ExtractedAccountDTO(account.name(), account.balance(), account.currency());
    }
}
