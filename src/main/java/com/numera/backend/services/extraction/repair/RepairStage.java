package com.numera.backend.services.extraction.repair;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One step of the response repair chain: text in, candidate objects out, or empty when the
 * stage cannot make sense of the text. Stages are pure and never throw on bad input.
 */
public interface RepairStage {

    String name();

    Optional<List<ObjectNode>> attempt(String text);
}
