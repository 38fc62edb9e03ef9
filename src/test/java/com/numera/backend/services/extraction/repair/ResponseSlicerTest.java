package com.numera.backend.services.extraction.repair;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ResponseSlicerTest {

    @Test
    void slice_removesFencesAndProse() {
        String raw = "Here is the data:\n```json\n{\"transactions\":[]}\n```\nLet me know if you need more.";

        assertEquals("{\"transactions\":[]}", ResponseSlicer.slice(raw));
    }

    @Test
    void slice_startsAtArrayWhenItComesFirst() {
        String raw = "Result: [{\"date\":\"2024-01-01\"}] done";

        assertEquals("[{\"date\":\"2024-01-01\"}]", ResponseSlicer.slice(raw));
    }

    @Test
    void slice_keepsTailWhenNoCloserFollowsTheOpener() {
        String raw = "prefix [{\"date\":\"2024-01-01\",";

        assertEquals("[{\"date\":\"2024-01-01\",", ResponseSlicer.slice(raw));
    }

    @Test
    void slice_returnsTrimmedTextWithoutBrackets() {
        assertEquals("no data here", ResponseSlicer.slice("  no data here \n"));
        assertEquals("", ResponseSlicer.slice(null));
    }
}
