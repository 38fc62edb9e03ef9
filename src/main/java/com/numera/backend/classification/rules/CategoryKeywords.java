package com.numera.backend.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.numera.backend.enums.TransactionCategory;

/**
 * Curated keyword sets used to map aggregator category labels onto the ledger categories.
 * Keywords are lowercase; matching is by substring.
 */
public final class CategoryKeywords {

    private CategoryKeywords() {}

    private record CategoryKeyword(TransactionCategory category, String keyword) {
        public CategoryKeyword {
            if (category == null) throw new IllegalArgumentException("category is required");
            if (keyword == null || keyword.isBlank()) throw new IllegalArgumentException("keyword is required");
        }
    }

    /**
     * Category to keywords, iterated in priority order: the first category with a hit wins.
     */
    public static final Map<TransactionCategory, List<String>> KEYWORDS_BY_PRIORITY;

    static {
        List<CategoryKeyword> items = new ArrayList<>();

        items.add(new CategoryKeyword(TransactionCategory.TRANSPORT, "transport"));
        items.add(new CategoryKeyword(TransactionCategory.TRANSPORT, "travel"));
        items.add(new CategoryKeyword(TransactionCategory.TRANSPORT, "gas"));
        items.add(new CategoryKeyword(TransactionCategory.TRANSPORT, "parking"));
        items.add(new CategoryKeyword(TransactionCategory.TRANSPORT, "taxi"));
        items.add(new CategoryKeyword(TransactionCategory.TRANSPORT, "airlines"));

        items.add(new CategoryKeyword(TransactionCategory.MEALS, "food"));
        items.add(new CategoryKeyword(TransactionCategory.MEALS, "restaurant"));
        items.add(new CategoryKeyword(TransactionCategory.MEALS, "groceries"));
        items.add(new CategoryKeyword(TransactionCategory.MEALS, "coffee"));

        items.add(new CategoryKeyword(TransactionCategory.SUPPLIES, "shops"));
        items.add(new CategoryKeyword(TransactionCategory.SUPPLIES, "supplies"));
        items.add(new CategoryKeyword(TransactionCategory.SUPPLIES, "hardware"));
        items.add(new CategoryKeyword(TransactionCategory.SUPPLIES, "merchandise"));

        items.add(new CategoryKeyword(TransactionCategory.SERVICES, "service"));
        items.add(new CategoryKeyword(TransactionCategory.SERVICES, "professional"));

        items.add(new CategoryKeyword(TransactionCategory.TAX, "tax"));
        items.add(new CategoryKeyword(TransactionCategory.TAX, "government"));

        items.add(new CategoryKeyword(TransactionCategory.PAYROLL, "payroll"));
        items.add(new CategoryKeyword(TransactionCategory.PAYROLL, "salary"));
        items.add(new CategoryKeyword(TransactionCategory.PAYROLL, "wages"));

        Map<TransactionCategory, List<String>> byCategory = new LinkedHashMap<>();
        for (CategoryKeyword item : items) {
            byCategory.computeIfAbsent(item.category(), k -> new ArrayList<>()).add(item.keyword());
        }
        byCategory.replaceAll((k, v) -> Collections.unmodifiableList(v));
        KEYWORDS_BY_PRIORITY = Collections.unmodifiableMap(byCategory);
    }
}
