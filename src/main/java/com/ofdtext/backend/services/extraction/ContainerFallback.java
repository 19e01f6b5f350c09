package com.ofdtext.backend.services.extraction;

/**
 * Where text is taken from when no known receipt container is present.
 */
public enum ContainerFallback {

    /**
     * Readability-style main-content detection, whole document when it finds nothing.
     */
    MAIN_CONTENT,

    /**
     * Always the whole document.
     */
    DOCUMENT
}
