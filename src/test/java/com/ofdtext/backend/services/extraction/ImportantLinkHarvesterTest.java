package com.ofdtext.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

class ImportantLinkHarvesterTest {

    private final ImportantLinkHarvester harvester = new ImportantLinkHarvester(ExtractionRules.defaults());

    @Test
    void findsReceiptPdfAndFnsCheckLinks() {
        String html = "<a href=\"https://lk.platformaofd.ru/web/noauth/cheque/pdf?id=1\">PDF</a>"
                + "<a href=\"https://lk.platformaofd.ru/web/noauth/cheque/pdf/oferta\">Оферта</a>"
                + "<a href=\"https://check.nalog.gov.ru/?fn=1\">ФНС</a>";

        LinkSet links = harvester.harvest(Jsoup.parse(html));

        assertEquals(Map.of(
                "pdf", "https://lk.platformaofd.ru/web/noauth/cheque/pdf?id=1",
                "fns", "https://check.nalog.gov.ru/?fn=1"
        ), links.asMap());
    }

    @Test
    void offerPdfIsExcludedRegardlessOfCase() {
        String html = "<a href=\"https://ofd.example/cheque/pdf/OFERTA.pdf\">Оферта</a>";

        assertTrue(harvester.harvest(Jsoup.parse(html)).isEmpty());
    }

    @Test
    void laterMatchesOverwriteEarlierOnes() {
        String html = "<a href=\"https://a.example/cheque/pdf?id=1\">1</a>"
                + "<a href=\"https://nalog.gov.ru/first\">1</a>"
                + "<a href=\"https://a.example/cheque/pdf?id=2\">2</a>"
                + "<a href=\"https://nalog.gov.ru/second\">2</a>";

        LinkSet links = harvester.harvest(Jsoup.parse(html));

        assertEquals("https://a.example/cheque/pdf?id=2", links.get(LinkKind.PDF).orElseThrow());
        assertEquals("https://nalog.gov.ru/second", links.get(LinkKind.FNS).orElseThrow());
    }

    @Test
    void linkMatchingBothKindsOnlyFillsPdf() {
        String html = "<a href=\"https://nalog.gov.ru/cheque/pdf?id=7\">x</a>";

        LinkSet links = harvester.harvest(Jsoup.parse(html));

        assertEquals(1, links.size());
        assertEquals("https://nalog.gov.ru/cheque/pdf?id=7", links.get(LinkKind.PDF).orElseThrow());
    }

    @Test
    void excludedOfferLinkCanStillBeTheFnsLink() {
        String html = "<a href=\"https://nalog.gov.ru/cheque/pdf/oferta\">x</a>";

        LinkSet links = harvester.harvest(Jsoup.parse(html));

        assertEquals(Map.of("fns", "https://nalog.gov.ru/cheque/pdf/oferta"), links.asMap());
    }

    @Test
    void usesRawHrefAndIgnoresAnchorsWithoutIt() {
        String html = "<a name=\"top\">top</a><a href=\"/web/noauth/cheque/pdf?id=3&amp;t=1\">PDF</a>";

        LinkSet links = harvester.harvest(Jsoup.parse(html));

        assertEquals("/web/noauth/cheque/pdf?id=3&t=1", links.get(LinkKind.PDF).orElseThrow());
    }

    @Test
    void pageWithoutLinksGivesEmptySet() {
        assertTrue(harvester.harvest(Jsoup.parse("<p>Нет ссылок</p>")).isEmpty());
    }
}
