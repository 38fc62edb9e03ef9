package com.numera.backend.services.extraction.repair;

import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numera.backend.exceptions.ExtractionFailureException;

import lombok.extern.slf4j.Slf4j;

/**
 * Ordered chain of {@link RepairStage}s. A stage runs only when every earlier stage failed.
 */
@Component
@Slf4j
public class RepairChain {

    public static final String UNPARSEABLE = "unparseable-response";

    private final List<RepairStage> stages;

    @Autowired
    public RepairChain() {
        this(defaultStages(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)));
    }

    RepairChain(List<RepairStage> stages) {
        this.stages = List.copyOf(stages);
    }

    static List<RepairStage> defaultStages(ObjectMapper mapper) {
        return List.of(
                new DirectParseStage(mapper),
                new ArrayRegexStage(mapper),
                new BracketBalanceStage(),
                new ObjectSalvageStage(mapper)
        );
    }

    public Result run(String slicedText) {
        for (RepairStage stage : stages) {
            Optional<List<ObjectNode>> parsed = stage.attempt(slicedText);
            if (parsed.isPresent()) {
                log.info("[RepairPipeline] stage '{}' produced {} objects", stage.name(), parsed.get().size());
                return new Result(stage.name(), parsed.get());
            }
            log.info("[RepairPipeline] stage '{}' could not parse the response", stage.name());
        }

        String excerpt = ExtractionFailureException.excerpt(slicedText);
        log.warn("[RepairPipeline] all stages failed (len={}) excerpt='{}'", slicedText == null ? 0 : slicedText.length(), excerpt);
        throw new ExtractionFailureException(UNPARSEABLE,
                "The extraction response could not be parsed", slicedText);
    }

    public record Result(String stage, List<ObjectNode> records) {
    }
}
