package com.numera.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numera.backend.config.IngestionProperties;
import com.numera.backend.enums.TransactionCategory;
import com.numera.backend.services.extraction.CandidateValidator.Validated;

class CandidateValidatorTest {

    private final CandidateValidator validator = new CandidateValidator(new IngestionProperties());

    private static ObjectNode transaction(String date, String description, Object amount, String category) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("date", date);
        node.put("description", description);
        if (amount instanceof Number n) node.put("amount", n.doubleValue());
        else node.put("amount", (String) amount);
        node.put("category", category);
        return node;
    }

    @Test
    void acceptsCanonicalTransaction() {
        Validated<CandidateTransaction> v = validator.validateTransaction(transaction("2024-12-14", "Taxi", -23.5, "TRANSPORT"));

        assertTrue(v.isValid());
        assertEquals(TransactionCategory.TRANSPORT, v.value().category());
        assertEquals("Taxi", v.value().description());
    }

    @Test
    void rejectsImpossibleCalendarDate() {
        Validated<CandidateTransaction> v = validator.validateTransaction(transaction("2024-02-30", "Taxi", -1, "TRANSPORT"));

        assertFalse(v.isValid());
    }

    @Test
    void rejectsBlankDescriptionTextAmountAndUnknownCategory() {
        assertFalse(validator.validateTransaction(transaction("2024-01-01", "  ", -1, "TRANSPORT")).isValid());
        assertFalse(validator.validateTransaction(transaction("2024-01-01", "Taxi", "12", "TRANSPORT")).isValid());
        assertFalse(validator.validateTransaction(transaction("2024-01-01", "Taxi", -1, "GROCERIES")).isValid());
    }

    @Test
    void accountWithMalformedCurrencyGetsDefault() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("name", "Main");
        node.put("balance", 120.5);
        node.put("currency", "euro");

        Validated<ExtractedAccount> v = validator.validateAccount(node);

        assertTrue(v.isValid());
        assertEquals("EUR", v.value().currency());
    }

    @Test
    void accountWithoutBalanceIsRejected() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("name", "Main");

        assertFalse(validator.validateAccount(node).isValid());
    }
}
