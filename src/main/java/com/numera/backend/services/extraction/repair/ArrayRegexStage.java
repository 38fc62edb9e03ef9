package com.numera.backend.services.extraction.repair;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ArrayRegexStage implements RepairStage {

    private static final Pattern ARRAY = Pattern.compile("\\[[\\s\\S]*\\]");

    private final ObjectMapper objectMapper;

    public ArrayRegexStage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "array-regex";
    }

    @Override
    public Optional<List<ObjectNode>> attempt(String text) {
        if (text == null) return Optional.empty();
        Matcher m = ARRAY.matcher(text);
        if (!m.find()) return Optional.empty();

        try {
            JsonNode node = objectMapper.readTree(m.group());
            // an empty array here is usually the "accounts": [] of a cut-off object
            return node.isArray() && node.size() > 0 ? JsonCandidates.fromNode(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("[RepairPipeline] array regex parse failed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
