package com.numera.backend.services.aggregator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One item of the aggregator's transactions/sync feed. A positive amount is money leaving
 * the account.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregatorTransaction(
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("account_id") String accountId,
        BigDecimal amount,
        @JsonProperty("iso_currency_code") String isoCurrencyCode,
        @JsonProperty("unofficial_currency_code") String unofficialCurrencyCode,
        String date,
        String name,
        @JsonProperty("merchant_name") String merchantName,
        List<String> category,
        @JsonProperty("personal_finance_category") PersonalFinanceCategory personalFinanceCategory,
        Boolean pending
) {

    public LocalDate dateAsLocalDate() {
        return date == null || date.isBlank() ? null : LocalDate.parse(date.trim());
    }

    /**
     * Free-text category hint: the personal finance category when present, else the first
     * legacy category.
     */
    public String categoryHint() {
        if (personalFinanceCategory != null && personalFinanceCategory.primary() != null
                && !personalFinanceCategory.primary().isBlank()) {
            return personalFinanceCategory.primary();
        }
        if (category != null && !category.isEmpty()) {
            return category.get(0);
        }
        return null;
    }

    public String currencyCode() {
        if (isoCurrencyCode != null && !isoCurrencyCode.isBlank()) return isoCurrencyCode;
        return unofficialCurrencyCode;
    }

    public boolean isPending() {
        return Boolean.TRUE.equals(pending);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PersonalFinanceCategory(String primary, String detailed) {
    }
}
