package com.ofdtext.backend.services.extraction;

/**
 * Thrown when the extraction pipeline cannot produce a result for a document.
 */
public class TextExtractionException extends RuntimeException {

    public TextExtractionException(String message) {
        super(message);
    }

    public TextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
