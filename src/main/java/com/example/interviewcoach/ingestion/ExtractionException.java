package com.example.interviewcoach.ingestion;

/**
 * Raised when no text can be obtained from a document, either because the bytes are
 * not a readable document or because both the text layer and OCR came back empty.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
