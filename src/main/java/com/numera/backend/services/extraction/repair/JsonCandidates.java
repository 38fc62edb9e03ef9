package com.numera.backend.services.extraction.repair;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Locates the candidate record list inside a parsed JSON value.
 */
final class JsonCandidates {

    static final String ACCOUNTS = "accounts";
    static final String TRANSACTIONS = "transactions";

    private JsonCandidates() {}

    static Optional<List<ObjectNode>> fromNode(JsonNode root) {
        if (root == null) return Optional.empty();
        if (root.isArray()) return Optional.of(objectsOf(root));
        if (!root.isObject()) return Optional.empty();

        JsonNode accounts = root.get(ACCOUNTS);
        JsonNode transactions = root.get(TRANSACTIONS);
        boolean hasContractKeys = (accounts != null && accounts.isArray()) || (transactions != null && transactions.isArray());
        if (hasContractKeys) {
            List<ObjectNode> out = new ArrayList<>();
            if (accounts != null && accounts.isArray()) out.addAll(objectsOf(accounts));
            if (transactions != null && transactions.isArray()) out.addAll(objectsOf(transactions));
            return Optional.of(out);
        }

        // model wrapped its output under an unexpected key
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isArray()) {
                return Optional.of(objectsOf(field.getValue()));
            }
        }

        if (looksLikeRecord(root)) {
            return Optional.of(List.of((ObjectNode) root));
        }
        return Optional.empty();
    }

    private static boolean looksLikeRecord(JsonNode node) {
        return node.has("date") || node.has("description") || node.has("amount")
                || (node.has("name") && node.has("balance"));
    }

    private static List<ObjectNode> objectsOf(JsonNode array) {
        List<ObjectNode> out = new ArrayList<>();
        for (JsonNode element : array) {
            if (element instanceof ObjectNode obj) {
                out.add(obj);
            }
        }
        return out;
    }
}
