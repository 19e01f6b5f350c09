package com.ofdtext.backend.services.extraction;

import java.util.regex.Pattern;

/**
 * Drops HTML comments from raw markup before it is parsed; receipt pages hide tracking payloads in them.
 */
public final class HtmlCommentStripper {

    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);

    private HtmlCommentStripper() {}

    public static String strip(String html) {
        if (html == null || html.isEmpty()) return "";
        return COMMENT.matcher(html).replaceAll("");
    }
}
