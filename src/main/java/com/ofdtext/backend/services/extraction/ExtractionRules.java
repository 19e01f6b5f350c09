package com.ofdtext.backend.services.extraction;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;

import com.ofdtext.backend.config.ExtractionProperties;

/**
 * Immutable, compiled form of {@link ExtractionProperties}. Built once at startup and shared by
 * every request, so it must never hold mutable state.
 */
public record ExtractionRules(
        List<ContainerRule> containers,
        int encodedMinLength,
        ContainerFallback fallback,
        boolean decodeEntitiesBeforeParse,
        MainContentRules mainContent,
        LinkRules links,
        List<String> unwantedTags,
        List<String> blockSelectors,
        List<Pattern> trackingUrlPatterns,
        List<Pattern> keepUrlPatterns,
        List<Pattern> noisePatterns,
        TrailerLabels trailer,
        DebugOptions debug
) {

    /**
     * Python-style case folding: Cyrillic phrases must match regardless of case, and \s / \d are Unicode-aware.
     */
    static final int NOISE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public record ContainerRule(String selector, boolean encoded) {
    }

    public record MainContentRules(int minTextLength, String baseUri) {
    }

    public record LinkRules(String pdfMarker, String pdfExclusion, String verificationMarker) {
    }

    public record TrailerLabels(String header, String pdfLabel, String verificationLabel) {
    }

    public record DebugOptions(boolean logExtractedText, int extractedTextMaxChars) {
    }

    public static ExtractionRules defaults() {
        return from(new ExtractionProperties());
    }

    public static ExtractionRules from(ExtractionProperties properties) {
        Objects.requireNonNull(properties, "properties");

        List<ContainerRule> containers = properties.getContainers().stream()
                .map(rule -> new ContainerRule(checkSelector(rule.getSelector()), rule.isEncoded()))
                .toList();

        ExtractionProperties.MainContent main = properties.getMainContent();
        MainContentRules mainContent = new MainContentRules(main.getMinTextLength(), main.getBaseUri());

        ExtractionProperties.Links links = properties.getLinks();
        ExtractionProperties.Trailer trailer = properties.getTrailer();

        return new ExtractionRules(
                containers,
                properties.getEncodedMinLength(),
                properties.getFallback(),
                properties.isDecodeEntitiesBeforeParse(),
                mainContent,
                new LinkRules(links.getPdfMarker(), links.getPdfExclusion(), links.getVerificationMarker()),
                List.copyOf(properties.getUnwantedTags()),
                properties.getBlockSelectors().stream().map(ExtractionRules::checkSelector).toList(),
                compile(properties.getTrackingUrlPatterns(), 0),
                compile(properties.getKeepUrlPatterns(), 0),
                compile(properties.getNoisePatterns(), NOISE_FLAGS),
                new TrailerLabels(trailer.getHeader(), trailer.getPdfLabel(), trailer.getVerificationLabel()),
                new DebugOptions(properties.getDebug().isLogExtractedText(), properties.getDebug().getExtractedTextMaxChars())
        );
    }

    private static List<Pattern> compile(List<String> regexes, int flags) {
        return regexes.stream().map(regex -> Pattern.compile(regex, flags)).toList();
    }

    // Fail at startup rather than on the first request that reaches the selector.
    private static String checkSelector(String selector) {
        try {
            QueryParser.parse(selector);
            return selector;
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid CSS selector in extractor configuration: " + selector, e);
        }
    }
}
