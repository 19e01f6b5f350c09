package com.ofdtext.backend.services.extraction;

import java.util.Optional;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the part of the page text is extracted from.
 *
 * Known receipt containers are tried in configured order and the first match wins. An encoded
 * container (OFD renders the receipt as HTML-escaped text inside #fido_cheque_container) is
 * decoded and parsed into a new document, but only when its text is long enough to be a receipt;
 * a shorter one is skipped. Without a container, the readability result or the whole page is used.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentContainerSelector {

    private final ExtractionRules rules;
    private final HtmlDocumentLoader documentLoader;
    private final MainContentExtractor mainContentExtractor;

    public enum Strategy {
        ENCODED_CONTAINER,
        CONTAINER,
        MAIN_CONTENT,
        DOCUMENT
    }

    /**
     * @param content   element to extract from; either part of the input tree or the root of a freshly parsed one
     * @param strategy  how it was found
     * @param selector  container selector that matched, null for fallbacks
     * @param container matched element of the input tree, null for fallbacks; for an encoded
     *                  container this is the element whose text was decoded into content
     */
    public record Selection(Element content, Strategy strategy, String selector, Element container) {

        public boolean isKnownContainer() {
            return strategy == Strategy.ENCODED_CONTAINER || strategy == Strategy.CONTAINER;
        }
    }

    public Selection select(Document document) {
        for (ExtractionRules.ContainerRule rule : rules.containers()) {
            Element container = document.selectFirst(rule.selector());
            if (container == null) continue;

            if (!rule.encoded()) {
                return new Selection(container, Strategy.CONTAINER, rule.selector(), container);
            }

            String encoded = container.wholeText();
            int length = encoded.codePointCount(0, encoded.length());
            if (length > rules.encodedMinLength()) {
                Document decoded = documentLoader.load(documentLoader.unescape(encoded));
                return new Selection(decoded, Strategy.ENCODED_CONTAINER, rule.selector(), container);
            }
            log.debug("[Container] '{}' found but holds only {} chars, trying next rule", rule.selector(), length);
        }

        if (rules.fallback() == ContainerFallback.MAIN_CONTENT) {
            Optional<Document> main = mainContentExtractor.extract(document);
            if (main.isPresent()) {
                return new Selection(main.get(), Strategy.MAIN_CONTENT, null, null);
            }
        }
        return new Selection(document, Strategy.DOCUMENT, null, null);
    }
}
