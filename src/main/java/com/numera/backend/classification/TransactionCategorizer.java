package com.numera.backend.classification;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.numera.backend.classification.rules.CategoryKeywords;
import com.numera.backend.enums.TransactionCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps a free-text aggregator category label to a ledger category. Only used for aggregator
 * feeds; extracted statements must carry a valid category already.
 */
@Service
@Slf4j
public class TransactionCategorizer {

    public TransactionCategory categorize(String hint) {
        if (hint == null || hint.isBlank()) {
            return TransactionCategory.OTHER;
        }

        String normalized = hint.toLowerCase(Locale.ROOT).trim();
        for (Map.Entry<TransactionCategory, List<String>> entry : CategoryKeywords.KEYWORDS_BY_PRIORITY.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (normalized.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }

        log.debug("[Categorizer] no keyword for hint '{}', using OTHER", hint);
        return TransactionCategory.OTHER;
    }
}
