package com.numera.backend.services.reconciliation;

import java.util.List;
import java.util.UUID;

/**
 * @param defaultAccountId first account reconciled in the run, null when none was
 */
public record AccountReconciliation(
        int created,
        int updated,
        UUID defaultAccountId,
        List<String> errors
) {
    public AccountReconciliation {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static AccountReconciliation empty() {
        return new AccountReconciliation(0, 0, null, List.of());
    }
}
