package com.numera.backend.services.extraction;

import java.math.BigDecimal;

public record ExtractedAccount(
        String name,
        BigDecimal balance,
        String currency
) {
}
