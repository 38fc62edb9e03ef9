package com.numera.backend.services.extraction;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decides what a parsed object is from its keys, ignoring which array the model put it in.
 */
@Component
public class RecordClassifier {

    public enum Kind {
        TRANSACTION,
        ACCOUNT,
        UNKNOWN
    }

    public Kind classify(JsonNode node) {
        if (node == null || !node.isObject()) return Kind.UNKNOWN;

        boolean hasDate = present(node, "date");
        boolean hasDescription = present(node, "description");

        if (present(node, "name") && present(node, "balance") && !hasDate && !hasDescription) {
            return Kind.ACCOUNT;
        }
        if (hasDate || hasDescription || present(node, "amount")) {
            return Kind.TRANSACTION;
        }
        return Kind.UNKNOWN;
    }

    private static boolean present(JsonNode node, String field) {
        return node.hasNonNull(field);
    }
}
