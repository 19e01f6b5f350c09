package com.ofdtext.backend.services.extraction;

/**
 * The HTML parser gave up on the input. Malformed markup alone never raises this;
 * only failures the parser cannot recover from do.
 */
public class HtmlParsingException extends TextExtractionException {

    public HtmlParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
