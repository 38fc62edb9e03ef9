package com.numera.backend.services.extraction.repair;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Last resort: parses every flat {...} fragment that carries a "date" key on its own.
 */
@Slf4j
public class ObjectSalvageStage implements RepairStage {

    private static final Pattern DATED_OBJECT = Pattern.compile("\\{[^{}]*\"date\"[^{}]*\\}");

    private final ObjectMapper objectMapper;

    public ObjectSalvageStage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "object-salvage";
    }

    @Override
    public Optional<List<ObjectNode>> attempt(String text) {
        if (text == null) return Optional.empty();

        List<ObjectNode> salvaged = new ArrayList<>();
        int fragments = 0;
        Matcher m = DATED_OBJECT.matcher(text);
        while (m.find()) {
            fragments++;
            try {
                JsonNode node = objectMapper.readTree(m.group());
                if (node instanceof ObjectNode obj) {
                    salvaged.add(obj);
                }
            } catch (JsonProcessingException e) {
                log.debug("[RepairPipeline] salvage skipped fragment at {}: {}", m.start(), e.getOriginalMessage());
            }
        }

        if (fragments > 0) {
            log.info("[RepairPipeline] salvaged {}/{} object fragments", salvaged.size(), fragments);
        }
        return salvaged.isEmpty() ? Optional.empty() : Optional.of(salvaged);
    }
}
