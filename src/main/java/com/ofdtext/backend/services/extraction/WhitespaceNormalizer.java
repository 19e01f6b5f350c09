package com.ofdtext.backend.services.extraction;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Final whitespace pass: at most one blank line in a row, no trailing blanks on a line,
 * nothing around the whole text. Applying it twice gives the same result.
 */
public final class WhitespaceNormalizer {

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");

    private WhitespaceNormalizer() {}

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String collapsed = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");

        StringJoiner out = new StringJoiner("\n");
        for (String line : TextLines.split(collapsed)) {
            out.add(TextLines.stripTrailing(line));
        }
        return TextLines.strip(out.toString());
    }
}
