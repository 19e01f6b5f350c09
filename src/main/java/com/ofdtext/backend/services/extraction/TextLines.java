package com.ofdtext.backend.services.extraction;

/**
 * Line helpers shared by the text stages. "Whitespace" here includes Unicode space separators
 * such as NBSP, which receipt pages use for alignment.
 */
final class TextLines {

    private TextLines() {}

    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    static String[] split(String text) {
        return text.split("\n", -1);
    }

    static String strip(String line) {
        return stripTrailing(stripLeading(line));
    }

    static String stripLeading(String line) {
        int start = 0;
        while (start < line.length() && isWhitespace(line.charAt(start))) start++;
        return line.substring(start);
    }

    static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && isWhitespace(line.charAt(end - 1))) end--;
        return line.substring(0, end);
    }
}
