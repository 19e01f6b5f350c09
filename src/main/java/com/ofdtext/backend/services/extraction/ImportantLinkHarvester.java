package com.ofdtext.backend.services.extraction;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Picks the receipt PDF link and the FNS verification link out of a page.
 *
 * Must run on the full tree before anything is removed from it: the links usually sit
 * outside the receipt container.
 */
@Component
@RequiredArgsConstructor
public class ImportantLinkHarvester {

    private final ExtractionRules rules;

    public LinkSet harvest(Element root) {
        return harvest(root, null, null);
    }

    /**
     * Harvests a page whose encoded container was decoded into a separate tree. The links of
     * the decoded tree count as if they stood in place of the container, so the usual
     * "later link wins" order follows the page as it reads after decoding.
     *
     * @param encodedContainer element of root holding the escaped markup, may be null
     * @param decodedContent   tree parsed from that markup, may be null
     */
    public LinkSet harvest(Element root, Element encodedContainer, Element decodedContent) {
        if (root == null) return LinkSet.empty();

        Map<LinkKind, String> found = new EnumMap<>(LinkKind.class);
        for (Element element : root.getAllElements()) {
            if (element == encodedContainer && decodedContent != null) {
                for (Element a : decodedContent.select("a[href]")) {
                    collect(a.attr("href"), found);
                }
            } else if ("a".equals(element.normalName()) && element.hasAttr("href")) {
                collect(element.attr("href"), found);
            }
        }
        return LinkSet.of(found);
    }

    // The last match wins for both kinds; a link fills at most one of them.
    private void collect(String href, Map<LinkKind, String> found) {
        ExtractionRules.LinkRules linkRules = rules.links();
        if (href.contains(linkRules.pdfMarker())
                && !href.toLowerCase(Locale.ROOT).contains(linkRules.pdfExclusion().toLowerCase(Locale.ROOT))) {
            found.put(LinkKind.PDF, href);
        } else if (href.contains(linkRules.verificationMarker())) {
            found.put(LinkKind.FNS, href);
        }
    }
}
