package com.ofdtext.backend.services.extraction;

import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Removes non-content elements (scripts, styles, embeds, images) and configured ad blocks in place.
 * Running it twice on the same tree changes nothing the second time.
 */
@Component
@RequiredArgsConstructor
public class UnwantedTagPruner {

    private final ExtractionRules rules;

    /**
     * @return number of removed elements, descendants of removed elements not counted
     */
    public int prune(Element root) {
        if (root == null) return 0;

        int removed = 0;
        for (String selector : rules.blockSelectors()) {
            removed += removeAll(root, selector);
        }
        for (String tag : rules.unwantedTags()) {
            removed += removeAll(root, tag);
        }
        return removed;
    }

    private int removeAll(Element root, String query) {
        int removed = 0;
        for (Element element : root.select(query)) {
            // An earlier match may already have taken this one out together with its parent.
            if (!isInside(element, root)) continue;
            element.remove();
            removed++;
        }
        return removed;
    }

    private static boolean isInside(Element element, Element root) {
        for (Element parent = element.parent(); parent != null; parent = parent.parent()) {
            if (parent == root) return true;
        }
        return false;
    }
}
