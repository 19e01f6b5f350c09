package com.ofdtext.backend.services.extraction;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Appends harvested links as a labelled section:
 *
 * <pre>
 * --- Ссылки ---
 * PDF чека: https://...
 * Проверка ФНС: https://...
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class LinkTrailerAppender {

    private final ExtractionRules rules;

    public String append(String text, LinkSet links) {
        String body = text == null ? "" : text;
        if (links == null || links.isEmpty()) return body;

        ExtractionRules.TrailerLabels labels = rules.trailer();
        StringBuilder out = new StringBuilder(body)
                .append("\n\n")
                .append(labels.header());

        links.get(LinkKind.PDF).ifPresent(url -> out.append('\n').append(labels.pdfLabel()).append(": ").append(url));
        links.get(LinkKind.FNS).ifPresent(url -> out.append('\n').append(labels.verificationLabel()).append(": ").append(url));
        return out.toString();
    }
}
