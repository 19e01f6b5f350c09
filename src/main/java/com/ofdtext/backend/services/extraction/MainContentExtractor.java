package com.ofdtext.backend.services.extraction;

import java.util.Optional;

import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dankito.readability4j.Article;
import net.dankito.readability4j.Readability4J;

/**
 * Main content of article pages without a known receipt container, found by Readability4J.
 *
 * The readability result is an HTML fragment; it is parsed into a new document, so the input
 * tree is never touched. Results shorter than the configured minimum are discarded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MainContentExtractor {

    private final ExtractionRules rules;
    private final HtmlDocumentLoader documentLoader;

    public Optional<Document> extract(Document document) {
        if (document == null) return Optional.empty();

        ExtractionRules.MainContentRules mainRules = rules.mainContent();

        String fragment;
        try {
            Article article = new Readability4J(mainRules.baseUri(), document.outerHtml()).parse();
            fragment = article.getContent();
        } catch (RuntimeException e) {
            log.warn("[MainContent] Readability failed, using whole document: {}", e.getMessage());
            return Optional.empty();
        }
        if (fragment == null || fragment.isBlank()) {
            log.debug("[MainContent] Readability found no article");
            return Optional.empty();
        }

        Document content = documentLoader.load(fragment);
        int textLength = content.text().length();
        if (textLength < mainRules.minTextLength()) {
            log.debug("[MainContent] Readability result too short ({} chars), using whole document", textLength);
            return Optional.empty();
        }
        log.debug("[MainContent] Readability article of {} chars", textLength);
        return Optional.of(content);
    }
}
