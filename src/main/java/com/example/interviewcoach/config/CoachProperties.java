package com.example.interviewcoach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the interview coach.
 */
@ConfigurationProperties(prefix = "interview")
public record CoachProperties(
        Lexicon lexicon,
        Extraction extraction
) {

    /**
     * Locations of the static reference data.
     *
     * @param location             lexicon file (e.g. classpath:lexicon/hr-lexicon.json)
     * @param questionBankLocation question bank file
     */
    public record Lexicon(String location, String questionBankLocation) {}

    /**
     * Configuration for document text extraction.
     *
     * @param ocrDpi        render resolution for OCR pages
     * @param tessdataPath  Tesseract data directory; blank uses the engine default
     * @param ocrLanguage   Tesseract language code
     * @param workerThreads size of the extraction worker pool
     */
    public record Extraction(int ocrDpi, String tessdataPath, String ocrLanguage, int workerThreads) {}
}
