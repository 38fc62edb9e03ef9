package com.numera.backend.services.extraction.repair;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DirectParseStage implements RepairStage {

    private final ObjectMapper objectMapper;

    public DirectParseStage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "direct-parse";
    }

    @Override
    public Optional<List<ObjectNode>> attempt(String text) {
        try {
            return JsonCandidates.fromNode(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            log.debug("[RepairPipeline] direct parse failed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
