package com.numera.backend.services.extraction;

import org.springframework.stereotype.Component;

import com.numera.backend.exceptions.ExtractionFailureException;
import com.numera.backend.services.ai.LlmCompletion;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a raw model completion into the text the repair pipeline expects.
 */
@Component
@Slf4j
public class ExtractionNormalizer {

    public String normalize(LlmCompletion completion) {
        String text = completion == null ? null : completion.text();
        if (text == null || text.isBlank()) {
            throw new ExtractionFailureException("empty-response", "The extraction service returned an empty response");
        }

        String normalized = text;
        if (normalized.charAt(0) == '\uFEFF') {
            normalized = normalized.substring(1);
        }
        normalized = normalized.replace("\u0000", "").trim();

        if (completion.truncated()) {
            log.warn("[ExtractionNormalizer] Completion hit the output token limit (len={}); expecting bracket repair",
                    normalized.length());
        }
        return normalized;
    }
}
