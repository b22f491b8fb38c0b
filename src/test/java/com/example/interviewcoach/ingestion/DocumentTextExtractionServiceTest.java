package com.example.interviewcoach.ingestion;

import com.example.interviewcoach.config.CoachProperties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DocumentTextExtractionServiceTest {

    private final OcrEngine ocrEngine = mock(OcrEngine.class);
    private final DocumentTextExtractionService service = new DocumentTextExtractionService(ocrEngine,
            new CoachProperties(
                    new CoachProperties.Lexicon("classpath:lexicon/hr-lexicon.json", "classpath:questions/hr-question-bank.json"),
                    new CoachProperties.Extraction(72, "", "eng", 1)));

    @Nested
    @DisplayName("Text layer")
    class TextLayer {

        @Test
        @DisplayName("should read the text layer without touching OCR")
        void readsTextLayer() throws IOException {
            byte[] pdf = pdf("In my role as team lead   I drove the migration.");

            String text = service.extractText(pdf);

            assertThat(text).isEqualTo("In my role as team lead I drove the migration.");
            verifyNoInteractions(ocrEngine);
        }

        @Test
        @DisplayName("should join the text of every page")
        void multiplePages() throws IOException {
            byte[] pdf = pdf("First page answer.", "Second page answer.");

            assertThat(service.extractText(pdf))
                    .contains("First page answer.")
                    .contains("Second page answer.");
        }
    }

    @Nested
    @DisplayName("OCR fallback")
    class OcrFallback {

        @Test
        @DisplayName("should OCR a document without a text layer")
        void fallsBackToOcr() throws IOException {
            when(ocrEngine.recognize(any(BufferedImage.class))).thenReturn("  Scanned    answer text \n");

            String text = service.extractText(pdf((String) null));

            assertThat(text).isEqualTo("Scanned answer text");
            verify(ocrEngine, times(1)).recognize(any(BufferedImage.class));
        }

        @Test
        @DisplayName("should report an unreadable document when OCR finds nothing")
        void ocrFindsNothing() throws IOException {
            when(ocrEngine.recognize(any(BufferedImage.class))).thenReturn("");

            assertThatThrownBy(() -> service.extractText(pdf((String) null)))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessage(DocumentTextExtractionService.NO_TEXT_MESSAGE);
        }

        @Test
        @DisplayName("should degrade an OCR engine failure to an unreadable document")
        void ocrEngineFails() throws IOException {
            when(ocrEngine.recognize(any(BufferedImage.class)))
                    .thenThrow(new ExtractionException("tesseract missing"));

            assertThatThrownBy(() -> service.extractText(pdf((String) null)))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessage(DocumentTextExtractionService.NO_TEXT_MESSAGE);
        }
    }

    @Test
    @DisplayName("should reject bytes that are not a PDF")
    void invalidPdf() {
        byte[] notPdf = "plain text, not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> service.extractText(notPdf))
                .isInstanceOf(ExtractionException.class)
                .hasMessageStartingWith("Failed to parse document:")
                .hasMessageEndingWith("The file may be corrupted or not a valid PDF.");
    }

    @Test
    @DisplayName("should reject empty input")
    void emptyInput() {
        assertThatThrownBy(() -> service.extractText(new byte[0]))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("no content");
    }

    /** One page per line; a null line yields a blank page. */
    private static byte[] pdf(String... pageLines) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (String line : pageLines) {
                PDPage page = new PDPage();
                document.addPage(page);
                if (line == null) {
                    continue;
                }
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(line);
                    content.endText();
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }
}
