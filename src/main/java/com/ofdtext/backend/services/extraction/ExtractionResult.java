package com.ofdtext.backend.services.extraction;

import java.util.Objects;

/**
 * Cleaned text, its length in characters (Unicode code points) and the links found on the page.
 */
public record ExtractionResult(
        String text,
        int length,
        LinkSet links
) {
    public ExtractionResult {
        Objects.requireNonNull(text, "text");
        if (links == null) links = LinkSet.empty();
        if (length != characterCount(text)) {
            throw new IllegalArgumentException("length " + length + " does not match text of " + characterCount(text) + " characters");
        }
    }

    public static ExtractionResult of(String text, LinkSet links) {
        return new ExtractionResult(text, characterCount(text), links);
    }

    /**
     * Characters as the response counts them: emoji outside the BMP count once, not as two UTF-16 units.
     */
    public static int characterCount(String text) {
        return text.codePointCount(0, text.length());
    }
}
