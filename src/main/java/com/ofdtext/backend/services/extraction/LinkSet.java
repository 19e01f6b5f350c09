package com.ofdtext.backend.services.extraction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * At most one URL per {@link LinkKind}. Filled by {@link ImportantLinkHarvester} and read-only afterwards.
 */
public final class LinkSet {

    private static final LinkSet EMPTY = new LinkSet(new EnumMap<>(LinkKind.class));

    private final Map<LinkKind, String> links;

    private LinkSet(EnumMap<LinkKind, String> links) {
        this.links = Collections.unmodifiableMap(links);
    }

    public static LinkSet empty() {
        return EMPTY;
    }

    public static LinkSet of(Map<LinkKind, String> links) {
        if (links == null || links.isEmpty()) return EMPTY;
        return new LinkSet(new EnumMap<>(links));
    }

    public Optional<String> get(LinkKind kind) {
        return Optional.ofNullable(links.get(kind));
    }

    public boolean isEmpty() {
        return links.isEmpty();
    }

    public int size() {
        return links.size();
    }

    /**
     * JSON view: {"pdf": "...", "fns": "..."} in declaration order of {@link LinkKind}.
     */
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        links.forEach((kind, url) -> out.put(kind.key(), url));
        return out;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
