package com.example.interviewcoach.ingestion;

import com.example.interviewcoach.config.CoachProperties;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts plain text from an uploaded PDF answer sheet.
 * <p>
 * The text layer is read first with PDFBox. Scanned documents without a text layer
 * are rendered page by page and passed to the {@link OcrEngine}. Output is normalized
 * with {@link TextNormalizer}.
 * <p>
 * Blocking: callers should run it off the request thread
 * (see {@code InterviewAssessmentService}).
 */
@Service
public class DocumentTextExtractionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractionService.class);

    static final String NO_TEXT_MESSAGE =
            "Could not extract text from document. The file may be empty or OCR failed.";

    private final OcrEngine ocrEngine;
    private final int ocrDpi;

    public DocumentTextExtractionService(OcrEngine ocrEngine, CoachProperties properties) {
        this.ocrEngine = ocrEngine;
        this.ocrDpi = properties.extraction().ocrDpi();
    }

    /**
     * Extracts the text of the document.
     *
     * @param documentBytes raw PDF bytes
     * @return normalized, non-blank text
     * @throws ExtractionException if the bytes are not a readable PDF or no text could be found
     */
    public String extractText(byte[] documentBytes) {
        if (documentBytes == null || documentBytes.length == 0) {
            throw new ExtractionException("Failed to parse document: no content. "
                    + "The file may be corrupted or not a valid PDF.");
        }
        log.info("Extracting text from document ({} bytes)", documentBytes.length);

        try (PDDocument document = Loader.loadPDF(documentBytes)) {
            String text = TextNormalizer.normalize(extractTextLayer(document));

            if (text.isBlank()) {
                log.info("No text layer found, falling back to OCR on {} page(s)", document.getNumberOfPages());
                text = extractWithOcr(document);
            }

            if (text.isBlank()) {
                throw new ExtractionException(NO_TEXT_MESSAGE);
            }

            log.info("Extraction completed: {} characters extracted", text.length());
            return text;

        } catch (IOException e) {
            throw new ExtractionException("Failed to parse document: " + e.getMessage()
                    + ". The file may be corrupted or not a valid PDF.", e);
        }
    }

    private String extractTextLayer(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");

        List<String> pages = new ArrayList<>();
        for (int page = 1; page <= document.getNumberOfPages(); page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            String pageText = stripper.getText(document);
            if (pageText != null && !pageText.isEmpty()) {
                pages.add(pageText);
            }
        }
        return String.join("\n", pages);
    }

    /** OCR failures degrade to empty text; the caller then reports the document as unreadable. */
    private String extractWithOcr(PDDocument document) {
        try {
            PDFRenderer renderer = new PDFRenderer(document);
            List<String> pages = new ArrayList<>();
            for (int page = 0; page < document.getNumberOfPages(); page++) {
                BufferedImage image = renderer.renderImageWithDPI(page, ocrDpi, ImageType.RGB);
                String pageText = ocrEngine.recognize(image);
                if (pageText != null && !pageText.isEmpty()) {
                    pages.add(pageText);
                }
            }
            return TextNormalizer.normalize(String.join("\n", pages));
        } catch (IOException | ExtractionException e) {
            log.warn("OCR extraction failed: {}", e.getMessage());
            return "";
        }
    }
}
