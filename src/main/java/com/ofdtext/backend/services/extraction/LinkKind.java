package com.ofdtext.backend.services.extraction;

/**
 * Links surfaced next to the extracted text. Declaration order is the order they are printed in.
 */
public enum LinkKind {

    PDF("pdf"),
    FNS("fns");

    private final String key;

    LinkKind(String key) {
        this.key = key;
    }

    /**
     * Key used in the JSON response.
     */
    public String key() {
        return key;
    }
}
