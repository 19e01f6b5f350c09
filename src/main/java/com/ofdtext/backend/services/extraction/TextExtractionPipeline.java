package com.ofdtext.backend.services.extraction;

import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTML in, readable text out.
 *
 * Order matters and is fixed: comments are stripped before parsing, links are harvested from the
 * untouched tree and from the decoded receipt when there is one, pruning happens only inside the
 * selected container, and the text stages run URL filter, noise scrubber, whitespace normalizer,
 * link trailer. Holds no per-request state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractionPipeline {

    private final ExtractionRules rules;
    private final HtmlDocumentLoader documentLoader;
    private final ImportantLinkHarvester linkHarvester;
    private final ContentContainerSelector containerSelector;
    private final UnwantedTagPruner tagPruner;
    private final PlainTextRenderer textRenderer;
    private final TrackingUrlFilter urlFilter;
    private final NoiseScrubber noiseScrubber;
    private final LinkTrailerAppender trailerAppender;

    public ExtractionResult extract(String html) {
        if (html == null || html.isEmpty()) {
            throw new IllegalArgumentException("HTML is empty");
        }

        String markup = rules.decodeEntitiesBeforeParse() ? documentLoader.unescape(html) : html;
        markup = HtmlCommentStripper.strip(markup);

        Document document = documentLoader.load(markup);

        // Selection does not modify the tree, so harvesting after it still sees every link.
        ContentContainerSelector.Selection selection = containerSelector.select(document);
        LinkSet links = selection.strategy() == ContentContainerSelector.Strategy.ENCODED_CONTAINER
                ? linkHarvester.harvest(document, selection.container(), selection.content())
                : linkHarvester.harvest(document);

        if (selection.isKnownContainer()) {
            log.info("[Extraction] Found OFD receipt container '{}' ({})", selection.selector(), selection.strategy());
        } else {
            log.debug("[Extraction] No receipt container, extracting from {}", selection.strategy());
        }

        int removed = tagPruner.prune(selection.content());
        log.debug("[Extraction] Pruned {} non-content elements", removed);

        String text = textRenderer.render(selection.content());
        text = urlFilter.filter(text);
        text = noiseScrubber.scrub(text);
        text = WhitespaceNormalizer.normalize(text);
        text = trailerAppender.append(text, links);

        logExtractedTextIfEnabled(text);
        return ExtractionResult.of(text, links);
    }

    private void logExtractedTextIfEnabled(String text) {
        ExtractionRules.DebugOptions debug = rules.debug();
        if (!debug.logExtractedText()) return;

        log.info("[Extraction][DEBUG] Extracted text ({} chars):\n{}",
                ExtractionResult.characterCount(text), debugSample(text, debug.extractedTextMaxChars()));
    }

    // Cuts on code point boundaries so a surrogate pair is never split.
    static String debugSample(String text, int maxChars) {
        if (ExtractionResult.characterCount(text) <= maxChars) return text;
        return text.substring(0, text.offsetByCodePoints(0, maxChars)) + "…";
    }
}
