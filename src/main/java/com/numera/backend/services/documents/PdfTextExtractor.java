package com.numera.backend.services.documents;

import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

@Service
public class PdfTextExtractor {

    /**
     * Extracts page by page; pages are separated by a blank line.
     */
    public String extractText(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        StringBuilder sb = new StringBuilder();
        int pages = document.getNumberOfPages();
        for (int page = 1; page <= pages; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            String text = stripper.getText(document);
            if (text == null || text.isBlank()) continue;
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(text.trim());
        }
        return sb.toString();
    }
}
