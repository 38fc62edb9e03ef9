package com.numera.backend.services.documents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.numera.backend.config.IngestionProperties;
import com.numera.backend.exceptions.ExtractionFailureException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.services.ai.ExtractionPrompts;
import com.numera.backend.services.ai.LlmCompletion;
import com.numera.backend.services.ai.LlmExtractionClient;

class DocumentStatementAdapterTest {

    private static final String STATEMENT_LINE = "14/12/2024  UBER TRIP PARIS                           -23,50 EUR";

    private IngestionProperties properties;
    private LlmExtractionClient llmClient;
    private DocumentStatementAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        llmClient = mock(LlmExtractionClient.class);
        adapter = new DocumentStatementAdapter(properties, new PdfTextExtractor(), llmClient);
    }

    private static byte[] pdfWithLines(String... lines) throws Exception {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage();
            doc.addPage(page);

            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.beginText();
                cs.setFont(PDType1Font.HELVETICA, 10);
                cs.newLineAtOffset(40, 750);
                for (String line : lines) {
                    cs.showText(line);
                    cs.newLineAtOffset(0, -14);
                }
                cs.endText();
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    @Test
    void sendsExtractedTextToTheModel() throws Exception {
        LlmCompletion completion = LlmCompletion.of("[]");
        when(llmClient.complete(anyString(), anyString(), anyLong())).thenReturn(completion);

        byte[] pdf = pdfWithLines("Statement December 2024", STATEMENT_LINE, STATEMENT_LINE);

        LlmCompletion result = adapter.extract(pdf, "application/pdf", "statement.pdf");

        assertSame(completion, result);
        ArgumentCaptor<String> input = ArgumentCaptor.forClass(String.class);
        verify(llmClient).complete(eq(ExtractionPrompts.DOCUMENT_INSTRUCTIONS), input.capture(),
                eq(DocumentStatementAdapter.MAX_OUTPUT_TOKENS));
        assertTrue(input.getValue().contains("UBER TRIP PARIS"));
    }

    @Test
    void imageOnlyDocumentFailsWithoutCallingTheModel() throws Exception {
        byte[] pdf = pdfWithLines("Page 1");

        ExtractionFailureException ex = assertThrows(ExtractionFailureException.class,
                () -> adapter.extract(pdf, "application/pdf", "scan.pdf"));

        assertEquals("document-not-viable", ex.getReason());
        verify(llmClient, never()).complete(anyString(), anyString(), anyLong());
    }

    @Test
    void longTextIsCutAndMarked() throws Exception {
        properties.getDocument().setMaxTextChars(100);
        when(llmClient.complete(anyString(), anyString(), anyLong())).thenReturn(LlmCompletion.of("[]"));

        byte[] pdf = pdfWithLines(STATEMENT_LINE, STATEMENT_LINE, STATEMENT_LINE, STATEMENT_LINE);

        adapter.extract(pdf, "application/pdf", "statement.pdf");

        ArgumentCaptor<String> input = ArgumentCaptor.forClass(String.class);
        verify(llmClient).complete(anyString(), input.capture(), anyLong());
        assertTrue(input.getValue().endsWith(DocumentStatementAdapter.TRUNCATION_MARKER));
        assertEquals(ExtractionPrompts.documentInput("").length() + 100 + DocumentStatementAdapter.TRUNCATION_MARKER.length(),
                input.getValue().length());
    }

    @Test
    void rejectsUnsupportedMediaType() {
        byte[] bytes = "date,amount\n2024-01-01,10".getBytes(StandardCharsets.UTF_8);

        InputRejectedException ex = assertThrows(InputRejectedException.class,
                () -> adapter.extract(bytes, "text/csv", "export.csv"));

        assertEquals("unsupported-media-type", ex.getReason());
    }

    @Test
    void rejectsPdfNamedFileWithoutPdfSignature() {
        byte[] bytes = "<html>not a pdf</html>".getBytes(StandardCharsets.UTF_8);

        InputRejectedException ex = assertThrows(InputRejectedException.class,
                () -> adapter.extract(bytes, "application/octet-stream", "statement.pdf"));

        assertEquals("unsupported-media-type", ex.getReason());
    }

    @Test
    void rejectsEmptyAndOversizedDocuments() {
        assertEquals("document-empty", assertThrows(InputRejectedException.class,
                () -> adapter.extract(new byte[0], "application/pdf", "a.pdf")).getReason());

        properties.getDocument().setMaxBytes(8);
        byte[] bytes = "%PDF-1.4 0123456789".getBytes(StandardCharsets.US_ASCII);
        assertEquals("document-too-large", assertThrows(InputRejectedException.class,
                () -> adapter.extract(bytes, "application/pdf", "a.pdf")).getReason());
    }

    @Test
    void rejectsPasswordProtectedDocument() throws Exception {
        byte[] pdf;
        try (PDDocument doc = new PDDocument()) {
            doc.addPage(new PDPage());
            doc.protect(new StandardProtectionPolicy("owner-secret", "user-secret", new AccessPermission()));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            pdf = out.toByteArray();
        }

        final byte[] encrypted = pdf;
        InputRejectedException ex = assertThrows(InputRejectedException.class,
                () -> adapter.extract(encrypted, "application/pdf", "locked.pdf"));

        assertEquals("document-encrypted", ex.getReason());
    }

    @Test
    void rejectsCorruptedPdf() {
        byte[] bytes = "%PDF-1.4\ngarbage without any object".getBytes(StandardCharsets.US_ASCII);

        InputRejectedException ex = assertThrows(InputRejectedException.class,
                () -> adapter.extract(bytes, "application/pdf", "broken.pdf"));

        assertEquals("document-unreadable", ex.getReason());
    }
}
