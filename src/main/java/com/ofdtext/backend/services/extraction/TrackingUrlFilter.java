package com.ofdtext.backend.services.extraction;

import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Removes advertising and analytics URLs from rendered text while keeping receipt and FNS links.
 *
 * Works line by line on text, not on the DOM. Only the first URL of a line is looked at.
 */
@Component
@RequiredArgsConstructor
public class TrackingUrlFilter {

    // Unicode-aware \s: a URL also ends at NBSP and other Unicode spaces.
    static final Pattern URL = Pattern.compile("https?://[^\\s<>\"]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final ExtractionRules rules;

    public String filter(String text) {
        if (text == null || text.isEmpty()) return "";

        StringJoiner out = new StringJoiner("\n");
        for (String line : TextLines.split(text)) {
            out.add(filterLine(line));
        }
        return out.toString();
    }

    String filterLine(String line) {
        Matcher matcher = URL.matcher(line);
        if (!matcher.find()) return line;

        if (isTracking(matcher.group())) {
            return line.substring(0, matcher.start()) + line.substring(matcher.end());
        }
        return line;
    }

    /**
     * A URL is dropped when some tracking pattern matches it and no keep pattern does.
     */
    public boolean isTracking(String url) {
        return matchesAny(rules.trackingUrlPatterns(), url) && !matchesAny(rules.keepUrlPatterns(), url);
    }

    private static boolean matchesAny(List<Pattern> patterns, String url) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(url).find()) return true;
        }
        return false;
    }
}
