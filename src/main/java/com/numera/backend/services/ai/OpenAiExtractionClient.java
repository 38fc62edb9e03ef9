package com.numera.backend.services.ai;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.numera.backend.exceptions.ExtractionFailureException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.responses.Response;
import com.openai.models.responses.ResponseCreateParams;
import com.openai.models.responses.ResponseOutputItem;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class OpenAiExtractionClient implements LlmExtractionClient {

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.model:gpt-4o}")
    private String model;

    @Value("${openai.temperature:0.1}")
    private double temperature;

    @Value("${openai.timeout-seconds:60}")
    private int timeoutSeconds;

    private volatile OpenAIClient client;

    @Override
    public LlmCompletion complete(String instructions, String input, long maxOutputTokens) {
        String key = apiKey == null ? "" : apiKey.trim();
        if (key.isEmpty()) {
            log.warn("[OpenAI] OPENAI_API_KEY missing; extraction unavailable");
            throw new ExtractionFailureException("model-unavailable", "The extraction service is not configured");
        }

        OpenAIClient c = getOrCreateClient(key);
        log.info("[OpenAI] Extraction call (inputLen={} model={} maxOutputTokens={})", input == null ? 0 : input.length(), model, maxOutputTokens);

        long start = System.currentTimeMillis();
        try {
            ResponseCreateParams params = ResponseCreateParams.builder()
                    .model(model)
                    .instructions(instructions)
                    .input(input)
                    .maxOutputTokens(maxOutputTokens)
                    .temperature(temperature)
                    .build();

            Response response = c.responses().create(params);
            String output = extractOutputText(response);
            boolean truncated = response.incompleteDetails().isPresent();

            log.info("[OpenAI] Extraction call done (outputLen={} truncated={} elapsedMs={})",
                    output.length(), truncated, System.currentTimeMillis() - start);
            return new LlmCompletion(output, truncated);
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - start;
            if (isTimeout(e)) {
                log.error("[OpenAI] Extraction call timed out after {}ms", elapsed);
                throw new ExtractionFailureException("model-timeout", "The extraction service did not answer in time", e);
            }
            log.error("[OpenAI] Extraction call failed (elapsedMs={}): {}", elapsed, e.toString());
            throw new ExtractionFailureException("model-call-failed", "The extraction service returned an error", e);
        }
    }

    private OpenAIClient getOrCreateClient(String key) {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            client = OpenAIOkHttpClient.builder()
                    .apiKey(key)
                    .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                    // SDK retries by default; a repeated model call may diverge
                    .maxRetries(0)
                    .build();
            return client;
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedIOException) return true;
        }
        return false;
    }

    private static String extractOutputText(Response response) {
        if (response == null) return "";
        StringBuilder sb = new StringBuilder();
        List<ResponseOutputItem> output = response.output();
        if (output == null || output.isEmpty()) return "";

        for (ResponseOutputItem item : output) {
            if (item == null) continue;
            item.message().ifPresent(message -> {
                if (message.content() == null) return;
                for (var content : message.content()) {
                    if (content == null) continue;
                    content.outputText().ifPresent(t -> {
                        String v = t.text();
                        if (v != null && !v.isBlank()) {
                            if (!sb.isEmpty()) sb.append('\n');
                            sb.append(v);
                        }
                    });
                }
            });
        }
        return sb.toString();
    }
}
