package com.numera.backend.services.spreadsheets;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.numera.backend.config.IngestionProperties;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.services.ai.ExtractionPrompts;
import com.numera.backend.services.ai.LlmCompletion;
import com.numera.backend.services.ai.LlmExtractionClient;
import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Delimited statement export to raw model output. Rows are re-serialized with a fixed
 * separator so the prompt does not depend on the export's delimiter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpreadsheetStatementAdapter {

    static final String CELL_SEPARATOR = " | ";
    static final long MAX_OUTPUT_TOKENS = 16_000;

    private static final char[] CANDIDATE_DELIMITERS = {';', ',', '\t', '|'};

    private final IngestionProperties properties;
    private final LlmExtractionClient llmClient;

    public LlmCompletion extract(String content) {
        IngestionProperties.Spreadsheet limits = properties.getSpreadsheet();

        if (content == null || content.isBlank()) {
            throw new InputRejectedException("spreadsheet-empty", "The uploaded file is empty");
        }
        if (content.length() > limits.getMaxChars()) {
            throw new InputRejectedException("spreadsheet-too-large",
                    "The file exceeds the maximum of " + limits.getMaxChars() + " characters");
        }

        String text = content.charAt(0) == '\uFEFF' ? content.substring(1) : content;
        char delimiter = detectDelimiter(text);
        List<String[]> rows = readRows(text, delimiter);
        if (rows.isEmpty()) {
            throw new InputRejectedException("spreadsheet-empty", "The file contains no data rows");
        }

        String serialized = serialize(rows, limits.getMaxPromptChars());
        log.info("[SpreadsheetAdapter] {} rows (delimiter='{}'), {} chars sent to the model",
                rows.size(), delimiter == '\t' ? "\\t" : String.valueOf(delimiter), serialized.length());

        return llmClient.complete(ExtractionPrompts.SPREADSHEET_INSTRUCTIONS, ExtractionPrompts.spreadsheetInput(serialized), MAX_OUTPUT_TOKENS);
    }

    /**
     * Picks the candidate that occurs most often on the first non-blank line; comma when none does.
     */
    static char detectDelimiter(String text) {
        String firstLine = text.lines().filter(l -> !l.isBlank()).findFirst().orElse("");
        char best = ',';
        long bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            long count = firstLine.chars().filter(c -> c == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static List<String[]> readRows(String text, char delimiter) {
        CSVParser parser = new CSVParserBuilder().withSeparator(delimiter).build();
        List<String[]> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text)).withCSVParser(parser).build()) {
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (isBlank(row)) continue;
                rows.add(row);
            }
        } catch (CsvValidationException | IOException e) {
            throw new InputRejectedException("spreadsheet-malformed", "The file could not be read as delimited text");
        }
        return rows;
    }

    private static boolean isBlank(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }

    private String serialize(List<String[]> rows, int budget) {
        StringBuilder sb = new StringBuilder();
        int written = 0;
        for (String[] row : rows) {
            List<String> cells = new ArrayList<>(row.length);
            for (String cell : row) {
                cells.add(cell == null ? "" : cell.trim());
            }
            String line = String.join(CELL_SEPARATOR, cells);
            if (sb.length() + line.length() + 1 > budget) {
                log.warn("[SpreadsheetAdapter] prompt budget reached after {}/{} rows", written, rows.size());
                break;
            }
            if (sb.length() > 0) sb.append('\n');
            sb.append(line);
            written++;
        }
        return sb.toString();
    }
}
