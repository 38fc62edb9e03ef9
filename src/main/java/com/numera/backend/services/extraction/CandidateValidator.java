package com.numera.backend.services.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.numera.backend.config.IngestionProperties;
import com.numera.backend.enums.TransactionCategory;

/**
 * Schema boundary between parsed model output and the canonical candidate types. Nothing
 * past this class sees a {@link JsonNode}.
 */
@Component
public class CandidateValidator {

    static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    private final IngestionProperties properties;

    public CandidateValidator(IngestionProperties properties) {
        this.properties = properties;
    }

    public Validated<CandidateTransaction> validateTransaction(JsonNode node) {
        JsonNode dateNode = node.get("date");
        if (dateNode == null || !dateNode.isTextual() || !DATE.matcher(dateNode.asText()).matches()) {
            return Validated.rejected("date missing or not YYYY-MM-DD");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(dateNode.asText());
        } catch (DateTimeParseException e) {
            return Validated.rejected("date is not a calendar date");
        }

        JsonNode descriptionNode = node.get("description");
        String description = descriptionNode == null || !descriptionNode.isTextual() ? "" : descriptionNode.asText().trim();
        if (description.isEmpty()) {
            return Validated.rejected("description empty");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            description = description.substring(0, MAX_DESCRIPTION_LENGTH);
        }

        Optional<BigDecimal> amount = finiteNumber(node.get("amount"));
        if (amount.isEmpty()) {
            return Validated.rejected("amount missing or not numeric");
        }

        JsonNode categoryNode = node.get("category");
        Optional<TransactionCategory> category = categoryNode != null && categoryNode.isTextual()
                ? TransactionCategory.fromLabel(categoryNode.asText())
                : Optional.empty();
        if (category.isEmpty()) {
            return Validated.rejected("category outside the enumeration");
        }

        return Validated.ok(new CandidateTransaction(date, description, amount.get(), category.get()));
    }

    public Validated<ExtractedAccount> validateAccount(JsonNode node) {
        JsonNode nameNode = node.get("name");
        String name = nameNode == null || !nameNode.isTextual() ? "" : nameNode.asText().trim();
        if (name.isEmpty()) {
            return Validated.rejected("account name empty");
        }

        Optional<BigDecimal> balance = finiteNumber(node.get("balance"));
        if (balance.isEmpty()) {
            return Validated.rejected("balance missing or not numeric");
        }

        JsonNode currencyNode = node.get("currency");
        String currency = currencyNode != null && currencyNode.isTextual() ? currencyNode.asText() : "";
        if (!CURRENCY.matcher(currency).matches()) {
            currency = properties.getDefaultCurrency();
        }

        return Validated.ok(new ExtractedAccount(name, balance.get(), currency));
    }

    private static Optional<BigDecimal> finiteNumber(JsonNode node) {
        if (node == null || !node.isNumber()) return Optional.empty();
        if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
            return Optional.empty();
        }
        return Optional.of(node.decimalValue());
    }

    /**
     * Either a valid value or the reason it was refused.
     */
    public record Validated<T>(T value, String rejection) {

        static <T> Validated<T> ok(T value) {
            return new Validated<>(value, null);
        }

        static <T> Validated<T> rejected(String reason) {
            return new Validated<>(null, reason);
        }

        public boolean isValid() {
            return rejection == null;
        }
    }
}
