package com.numera.backend.services.ai;

/**
 * Raw text returned by the extraction model.
 *
 * @param truncated true when the model stopped on its output token limit
 */
public record LlmCompletion(String text, boolean truncated) {

    public static LlmCompletion of(String text) {
        return new LlmCompletion(text, false);
    }
}
