package com.numera.backend.classification.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.numera.backend.enums.TransactionCategory;

class CategoryKeywordsTest {

    @Test
    void categoriesAreIteratedInPriorityOrder() {
        assertEquals(List.of(
                        TransactionCategory.TRANSPORT,
                        TransactionCategory.MEALS,
                        TransactionCategory.SUPPLIES,
                        TransactionCategory.SERVICES,
                        TransactionCategory.TAX,
                        TransactionCategory.PAYROLL),
                new ArrayList<>(CategoryKeywords.KEYWORDS_BY_PRIORITY.keySet()));
    }

    @Test
    void keywordSetsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> CategoryKeywords.KEYWORDS_BY_PRIORITY.get(TransactionCategory.TAX).add("vat"));
        assertThrows(UnsupportedOperationException.class,
                () -> CategoryKeywords.KEYWORDS_BY_PRIORITY.remove(TransactionCategory.TAX));
    }
}
