package com.ofdtext.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import com.ofdtext.backend.config.ExtractionProperties;

class UnwantedTagPrunerTest {

    @Test
    void removesNonContentElementsWithTheirChildren() {
        Document doc = Jsoup.parse("<html><head><meta charset=\"utf-8\"><link rel=\"stylesheet\" href=\"a.css\">"
                + "<style>.x{}</style></head><body><p>Текст</p><script>track()</script>"
                + "<noscript><img src=\"pixel.gif\"></noscript><iframe src=\"ad.html\"></iframe>"
                + "<svg><text>logo</text></svg><img alt=\"волна\" src=\"wave.png\"></body></html>");

        new UnwantedTagPruner(ExtractionRules.defaults()).prune(doc);

        for (String tag : List.of("meta", "link", "style", "script", "noscript", "iframe", "svg", "img")) {
            assertTrue(doc.select(tag).isEmpty(), tag + " should be gone");
        }
        assertEquals("Текст", doc.body().text());
    }

    @Test
    void secondRunIsANoOp() {
        Document doc = Jsoup.parse("<div><script>a()</script><p>Text</p><img src=\"x.png\"></div>");
        UnwantedTagPruner pruner = new UnwantedTagPruner(ExtractionRules.defaults());

        int first = pruner.prune(doc);
        String afterFirst = doc.outerHtml();
        int second = pruner.prune(doc);

        assertEquals(2, first);
        assertEquals(0, second);
        assertEquals(afterFirst, doc.outerHtml());
    }

    @Test
    void onlyTouchesTheGivenSubtree() {
        Document doc = Jsoup.parse("<div id=\"outside\"><img src=\"a.png\"></div><div id=\"receipt\"><img src=\"b.png\"></div>");
        Element receipt = doc.getElementById("receipt");

        new UnwantedTagPruner(ExtractionRules.defaults()).prune(receipt);

        assertTrue(receipt.select("img").isEmpty());
        assertEquals(1, doc.select("#outside img").size());
    }

    @Test
    void removesConfiguredAdvertisingBlocks() {
        ExtractionProperties properties = new ExtractionProperties();
        properties.setBlockSelectors(List.of(".promo", "#gift-banner"));
        Document doc = Jsoup.parse("<p>Чек</p><div class=\"promo\">Скидка</div><section id=\"gift-banner\">Подарок</section>");

        new UnwantedTagPruner(ExtractionRules.from(properties)).prune(doc);

        assertEquals("Чек", doc.body().text());
        assertFalse(doc.body().html().contains("promo"));
    }
}
