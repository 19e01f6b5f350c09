package com.ofdtext.backend.services.extraction;

import java.util.StringJoiner;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Strips promotional copy ("Вам подарки за проведенную оплату", "Забрать", ...) and decorative
 * image alt-texts, then compacts the text to one non-empty line per line.
 *
 * Phrases go first: removing them leaves blank lines and double spaces behind.
 */
@Component
@RequiredArgsConstructor
public class NoiseScrubber {

    private static final Pattern BLANK_LINES = Pattern.compile("\n{2,}");
    private static final Pattern SPACE_RUNS = Pattern.compile(" {2,}");

    private final ExtractionRules rules;

    public String scrub(String text) {
        if (text == null || text.isEmpty()) return "";

        String cleaned = text;
        for (Pattern noise : rules.noisePatterns()) {
            cleaned = noise.matcher(cleaned).replaceAll("");
        }

        cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n");
        cleaned = SPACE_RUNS.matcher(cleaned).replaceAll(" ");

        StringJoiner out = new StringJoiner("\n");
        for (String line : TextLines.split(cleaned)) {
            String stripped = TextLines.strip(line);
            if (!stripped.isEmpty()) out.add(stripped);
        }
        return out.toString();
    }
}
