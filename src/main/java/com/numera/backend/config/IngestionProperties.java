package com.numera.backend.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "numera.ingestion")
public class IngestionProperties {

    /**
     * Currency applied to extracted accounts whose currency is missing or malformed.
     */
    private String defaultCurrency = "EUR";

    private Document document = new Document();

    private Spreadsheet spreadsheet = new Spreadsheet();

    public String getDefaultCurrency() {
        return defaultCurrency;
    }

    public void setDefaultCurrency(String defaultCurrency) {
        this.defaultCurrency = defaultCurrency;
    }

    public Document getDocument() {
        return document;
    }

    public void setDocument(Document document) {
        this.document = document;
    }

    public Spreadsheet getSpreadsheet() {
        return spreadsheet;
    }

    public void setSpreadsheet(Spreadsheet spreadsheet) {
        this.spreadsheet = spreadsheet;
    }

    public static class Document {

        /**
         * Uploads larger than this are rejected before PDFBox opens them.
         */
        private long maxBytes = 10L * 1024 * 1024;

        private List<String> allowedMimeTypes = List.of("application/pdf");

        /**
         * Below this many extracted characters the document is treated as image-only.
         */
        private int minTextLength = 50;

        /**
         * Character budget sent to the model; longer text is cut and marked.
         */
        private int maxTextChars = 15_000;

        public long getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        public List<String> getAllowedMimeTypes() {
            return allowedMimeTypes;
        }

        public void setAllowedMimeTypes(List<String> allowedMimeTypes) {
            this.allowedMimeTypes = allowedMimeTypes;
        }

        public int getMinTextLength() {
            return minTextLength;
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }

        public int getMaxTextChars() {
            return maxTextChars;
        }

        public void setMaxTextChars(int maxTextChars) {
            this.maxTextChars = maxTextChars;
        }
    }

    public static class Spreadsheet {

        /**
         * Hard cap on the decoded upload; larger files are rejected.
         */
        private int maxChars = 1_000_000;

        /**
         * Character budget of the serialized rows sent to the model.
         */
        private int maxPromptChars = 100_000;

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }

        public int getMaxPromptChars() {
            return maxPromptChars;
        }

        public void setMaxPromptChars(int maxPromptChars) {
            this.maxPromptChars = maxPromptChars;
        }
    }
}
