package com.numera.backend.enums;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum TransactionCategory {
    TRANSPORT,
    MEALS,
    SUPPLIES,
    SERVICES,
    TAX,
    PAYROLL,
    OTHER;

    // Labels of the first (French) release, still emitted by older prompts and exports.
    private static final Map<String, TransactionCategory> LEGACY_LABELS = Map.of(
            "REPAS", MEALS,
            "MATERIEL", SUPPLIES,
            "PRESTATION", SERVICES,
            "IMPOTS", TAX,
            "SALAIRES", PAYROLL,
            "AUTRE", OTHER
    );

    /**
     * Strict lookup of an already normalized (trimmed, upper-case) label.
     */
    public static Optional<TransactionCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        String key = label.trim().toUpperCase(Locale.ROOT);
        for (TransactionCategory c : values()) {
            if (c.name().equals(key)) return Optional.of(c);
        }
        return Optional.ofNullable(LEGACY_LABELS.get(key));
    }

    public static String canonicalLabel(String label) {
        if (label == null) return null;
        String key = label.trim().toUpperCase(Locale.ROOT);
        TransactionCategory legacy = LEGACY_LABELS.get(key);
        return legacy != null ? legacy.name() : key;
    }
}
