package com.numera.backend.services.ai;

/**
 * Synchronous, single round-trip call to the extraction model.
 *
 * Implementations must not retry: a second call for the same input can return a different
 * answer, and a visible failure is preferred over a silently divergent result.
 */
public interface LlmExtractionClient {

    /**
     * @throws com.numera.backend.exceptions.ExtractionFailureException on missing configuration,
     *         service error or timeout
     */
    LlmCompletion complete(String instructions, String input, long maxOutputTokens);
}
