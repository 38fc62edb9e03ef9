package com.numera.backend.services.documents;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Service;

import com.numera.backend.config.IngestionProperties;
import com.numera.backend.exceptions.ExtractionFailureException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.services.ai.ExtractionPrompts;
import com.numera.backend.services.ai.LlmCompletion;
import com.numera.backend.services.ai.LlmExtractionClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Statement document to raw model output. Cheap checks (size, type, signature) run before
 * PDFBox ever sees the bytes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStatementAdapter {

    public static final String TRUNCATION_MARKER = "\n\n[... text truncated ...]";
    static final long MAX_OUTPUT_TOKENS = 4_000;

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final IngestionProperties properties;
    private final PdfTextExtractor pdfTextExtractor;
    private final LlmExtractionClient llmClient;

    public LlmCompletion extract(byte[] bytes, String mimeType, String filename) {
        IngestionProperties.Document limits = properties.getDocument();

        if (bytes == null || bytes.length == 0) {
            throw new InputRejectedException("document-empty", "The uploaded document is empty");
        }
        if (bytes.length > limits.getMaxBytes()) {
            throw new InputRejectedException("document-too-large",
                    "The document exceeds the maximum size of " + (limits.getMaxBytes() / (1024 * 1024)) + " MB");
        }
        if (!isAllowedType(mimeType, filename, limits)) {
            throw new InputRejectedException("unsupported-media-type", "Only PDF documents are supported");
        }
        if (!hasPdfSignature(bytes)) {
            throw new InputRejectedException("unsupported-media-type", "The file is not a valid PDF document");
        }

        String text = readText(bytes).trim();
        log.info("[DocumentAdapter] extracted {} chars from '{}'", text.length(), filename);

        if (text.length() < limits.getMinTextLength()) {
            throw new ExtractionFailureException("document-not-viable",
                    "The document has no readable text layer (it may be a scanned image)", text);
        }

        if (text.length() > limits.getMaxTextChars()) {
            log.info("[DocumentAdapter] truncating text from {} to {} chars", text.length(), limits.getMaxTextChars());
            text = text.substring(0, limits.getMaxTextChars()) + TRUNCATION_MARKER;
        }

        return llmClient.complete(ExtractionPrompts.DOCUMENT_INSTRUCTIONS, ExtractionPrompts.documentInput(text), MAX_OUTPUT_TOKENS);
    }

    private String readText(byte[] bytes) {
        try (PDDocument document = PDDocument.load(bytes)) {
            return pdfTextExtractor.extractText(document);
        } catch (InvalidPasswordException e) {
            throw new InputRejectedException("document-encrypted", "Password-protected PDF documents are not supported");
        } catch (IOException e) {
            log.warn("[DocumentAdapter] PDFBox could not read the document: {}", e.getMessage());
            throw new InputRejectedException("document-unreadable", "The PDF document could not be read");
        }
    }

    private static boolean isAllowedType(String mimeType, String filename, IngestionProperties.Document limits) {
        if (mimeType != null) {
            String normalized = mimeType.toLowerCase(Locale.ROOT).trim();
            if (limits.getAllowedMimeTypes().stream().anyMatch(normalized::equals)) {
                return true;
            }
        }
        // browsers send application/octet-stream for some PDFs
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static boolean hasPdfSignature(byte[] bytes) {
        // the header may be preceded by a few junk bytes
        int limit = Math.min(bytes.length - PDF_SIGNATURE.length, 1024);
        for (int i = 0; i <= limit; i++) {
            boolean match = true;
            for (int j = 0; j < PDF_SIGNATURE.length; j++) {
                if (bytes[i + j] != PDF_SIGNATURE[j]) {
                    match = false;
                    break;
                }
            }
            if (match) return true;
        }
        return false;
    }
}
