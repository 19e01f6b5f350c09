package com.ofdtext.backend.services.extraction;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Parses markup into a jsoup tree. jsoup repairs broken markup on its own, so invalid structure
 * never fails here; anything the parser throws anyway is reported as {@link HtmlParsingException}.
 */
@Component
public class HtmlDocumentLoader {

    public Document load(String html) {
        try {
            return Jsoup.parse(html == null ? "" : html);
        } catch (RuntimeException e) {
            throw new HtmlParsingException("Failed to parse HTML: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes HTML entities (&amp;lt; &amp;amp; &amp;#1058; ...) of a text that carries escaped markup.
     */
    public String unescape(String escaped) {
        if (escaped == null || escaped.isEmpty()) return "";
        return Parser.unescapeEntities(escaped, false);
    }
}
