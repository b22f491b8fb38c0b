package com.example.interviewcoach.ingestion;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over a rendered page image.
 */
public interface OcrEngine {

    /**
     * @param pageImage rendered page
     * @return recognized text, possibly empty
     * @throws ExtractionException if the engine fails
     */
    String recognize(BufferedImage pageImage);
}
