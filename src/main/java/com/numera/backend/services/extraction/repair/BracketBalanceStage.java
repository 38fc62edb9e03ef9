package com.numera.backend.services.extraction.repair;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Closes structures left open by a response cut short (usually by the output token limit).
 */
@Slf4j
public class BracketBalanceStage implements RepairStage {

    private final ObjectMapper lenientMapper;

    public BracketBalanceStage() {
        this.lenientMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .build();
    }

    @Override
    public String name() {
        return "bracket-balance";
    }

    @Override
    public Optional<List<ObjectNode>> attempt(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        String repaired = balance(text);
        if (repaired == null) return Optional.empty();

        try {
            return JsonCandidates.fromNode(lenientMapper.readTree(repaired)).filter(records -> !records.isEmpty());
        } catch (JsonProcessingException e) {
            log.debug("[RepairPipeline] bracket balance parse failed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * @return the text with missing closers appended, or null when nothing was left open
     */
    static String balance(String text) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> open.push(c);
                case '}' -> {
                    if (!open.isEmpty() && open.peek() == '{') open.pop();
                }
                case ']' -> {
                    if (!open.isEmpty() && open.peek() == '[') open.pop();
                }
                default -> { }
            }
        }

        if (open.isEmpty() && !inString) return null;

        StringBuilder sb = new StringBuilder(text);
        if (inString) {
            if (escaped) sb.setLength(sb.length() - 1);
            sb.append('"');
        }
        trimTrailing(sb);
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ',') {
            sb.setLength(sb.length() - 1);
        } else if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ':') {
            sb.append("null");
        }
        while (!open.isEmpty()) {
            sb.append(open.pop() == '{' ? '}' : ']');
        }
        return sb.toString();
    }

    private static void trimTrailing(StringBuilder sb) {
        while (sb.length() > 0 && Character.isWhitespace(sb.charAt(sb.length() - 1))) {
            sb.setLength(sb.length() - 1);
        }
    }
}
