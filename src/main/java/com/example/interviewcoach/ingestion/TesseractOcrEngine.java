package com.example.interviewcoach.ingestion;

import com.example.interviewcoach.config.CoachProperties;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * {@link OcrEngine} backed by Tess4J.
 * <p>
 * A Tesseract instance is not thread-safe, so one is created per page. The native
 * library is only loaded on first recognition; environments without Tesseract
 * installed fail at that point with an {@link ExtractionException}.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final String datapath;
    private final String language;

    public TesseractOcrEngine(CoachProperties properties) {
        this.datapath = properties.extraction().tessdataPath();
        this.language = properties.extraction().ocrLanguage();
    }

    @Override
    public String recognize(BufferedImage pageImage) {
        ITesseract tesseract = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }
        if (language != null && !language.isBlank()) {
            tesseract.setLanguage(language);
        }
        try {
            String text = tesseract.doOCR(pageImage);
            log.debug("OCR recognized {} characters ({}x{} px)",
                    text != null ? text.length() : 0, pageImage.getWidth(), pageImage.getHeight());
            return text != null ? text : "";
        } catch (TesseractException | LinkageError e) {
            throw new ExtractionException("OCR engine failed: " + e.getMessage(), e);
        }
    }
}
