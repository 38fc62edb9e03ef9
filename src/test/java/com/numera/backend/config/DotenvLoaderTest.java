package com.numera.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DotenvLoaderTest {

    private static final String KEY = "NUMERA_DOTENV_TEST_KEY";

    @AfterEach
    void clear() {
        System.clearProperty(KEY);
    }

    @Test
    void applyLine_setsQuotedAndExportedValues() {
        assertTrue(DotenvLoader.applyLine("export " + KEY + "=\"sk-test-123\""));
        assertEquals("sk-test-123", System.getProperty(KEY));
    }

    @Test
    void applyLine_ignoresCommentsBlanksAndMalformedLines() {
        assertFalse(DotenvLoader.applyLine("# " + KEY + "=x"));
        assertFalse(DotenvLoader.applyLine("   "));
        assertFalse(DotenvLoader.applyLine("=value"));
        assertFalse(DotenvLoader.applyLine(KEY + "="));
    }

    @Test
    void applyLine_neverOverridesExistingValue() {
        System.setProperty(KEY, "from-system");

        assertFalse(DotenvLoader.applyLine(KEY + "=from-file"));
        assertEquals("from-system", System.getProperty(KEY));
    }

    @Test
    void resolveBaseUrl_prefersExplicitUrlOverEnvironment() {
        AggregatorProperties properties = new AggregatorProperties();
        assertEquals("https://sandbox.plaid.com", properties.resolveBaseUrl());

        properties.setEnv("production");
        assertEquals("https://production.plaid.com", properties.resolveBaseUrl());

        properties.setBaseUrl("http://localhost:9090/");
        assertEquals("http://localhost:9090", properties.resolveBaseUrl());
    }
}
