package com.numera.backend.services.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import com.numera.backend.exceptions.ExtractionFailureException;

class OpenAiExtractionClientTest {

    @Test
    void complete_withoutApiKeyFailsAsModelUnavailable() {
        OpenAiExtractionClient client = new OpenAiExtractionClient();
        ReflectionTestUtils.setField(client, "apiKey", "  ");

        ExtractionFailureException ex = assertThrows(ExtractionFailureException.class,
                () -> client.complete(ExtractionPrompts.DOCUMENT_INSTRUCTIONS, ExtractionPrompts.documentInput("x"), 100));

        assertEquals("model-unavailable", ex.getReason());
    }

    @Test
    void prompts_carryTheOutputContract() {
        for (String instructions : new String[]{ExtractionPrompts.DOCUMENT_INSTRUCTIONS, ExtractionPrompts.SPREADSHEET_INSTRUCTIONS}) {
            assertTrue(instructions.contains("TRANSPORT"));
            assertTrue(instructions.contains("\"transactions\""));
        }
    }
}
