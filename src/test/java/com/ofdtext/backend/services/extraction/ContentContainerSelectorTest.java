package com.ofdtext.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import com.ofdtext.backend.config.ExtractionProperties;

class ContentContainerSelectorTest {

    private static final String RECEIPT_MARKUP = "<div class=\"receipt\">"
            + "<p>ООО Ромашка, ИНН 7700000000</p>"
            + "<p>Кассовый чек</p><p>Молоко 89.90</p><p>Хлеб 45.00</p><p>Итого: 134.90</p>"
            + "</div>";

    private final HtmlDocumentLoader loader = new HtmlDocumentLoader();

    private ContentContainerSelector selector(ExtractionRules rules) {
        return new ContentContainerSelector(rules, loader, new MainContentExtractor(rules, loader));
    }

    private static String escape(String markup) {
        return markup.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    @Test
    void decodesLongEncodedContainerIntoNewDocument() {
        Document page = loader.load("<body><div id=\"fido_cheque_container\">" + escape(RECEIPT_MARKUP) + "</div>"
                + "<div class=\"check_ctn\">Другой контейнер</div></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertEquals(ContentContainerSelector.Strategy.ENCODED_CONTAINER, selection.strategy());
        assertEquals("#fido_cheque_container", selection.selector());
        assertTrue(selection.isKnownContainer());
        assertInstanceOf(Document.class, selection.content());
        assertEquals(5, selection.content().select("div.receipt > p").size());
    }

    @Test
    void shortEncodedContainerFallsThroughToNextRule() {
        Document page = loader.load("<body><div id=\"fido_cheque_container\">&lt;p&gt;пусто&lt;/p&gt;</div>"
                + "<div class=\"check_ctn\"><p>Кассовый чек</p></div></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertEquals(ContentContainerSelector.Strategy.CONTAINER, selection.strategy());
        assertEquals(".check_ctn", selection.selector());
        assertEquals("Кассовый чек", selection.content().text());
    }

    @Test
    void ruleOrderWinsOverDocumentOrder() {
        Document page = loader.load("<body><div class=\"js__cheque_fido_constructor\">" + "Конструктор чека ".repeat(10) + "</div>"
                + "<div class=\"check_ctn\">Чек</div></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertEquals(".check_ctn", selection.selector());
    }

    @Test
    void plainContainerIsPartOfTheInputTree() {
        Document page = loader.load("<body><div class=\"check_ctn\">Чек</div></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertSame(page.selectFirst(".check_ctn"), selection.content());
        assertSame(selection.content(), selection.container());
    }

    @Test
    void shortConstructorPlaceholderIsSkipped() {
        Document page = loader.load("<body><p>Кассовый чек №1 Итого: 134.90</p>"
                + "<div class=\"js__cheque_fido_constructor\">Загрузка...</div></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertEquals(ContentContainerSelector.Strategy.DOCUMENT, selection.strategy());
        assertSame(page, selection.content());
        assertTrue(selection.content().text().contains("Кассовый чек №1"));
    }

    @Test
    void longConstructorIsReparsedFromItsText() {
        String receipt = "Кассовый чек №1, ООО Ромашка, ИНН 7700000000, Молоко 89.90, Хлеб 45.00, Итого: 134.90, спасибо за покупку, приходите ещё";
        Document page = loader.load("<body><div class=\"js__cheque_fido_constructor\"><span>" + receipt + "</span></div></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertEquals(ContentContainerSelector.Strategy.ENCODED_CONTAINER, selection.strategy());
        assertEquals(".js__cheque_fido_constructor", selection.selector());
        assertSame(page.selectFirst(".js__cheque_fido_constructor"), selection.container());
        assertEquals(receipt, selection.content().text());
    }

    @Test
    void fallsBackToMainContentForArticles() {
        String paragraph = "Покупка оформлена в магазине у дома, чек сохранён, спасибо за то, что выбрали нас. ";
        Document page = loader.load("<body><div class=\"sidebar\"><a href=\"/promo\">Реклама партнёров</a></div><article>"
                + ("<p>" + paragraph.repeat(2) + "</p>").repeat(4) + "</article></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertEquals(ContentContainerSelector.Strategy.MAIN_CONTENT, selection.strategy());
        assertInstanceOf(Document.class, selection.content());
        assertTrue(selection.content().text().contains("чек сохранён"));
        assertFalse(selection.content().text().contains("Реклама партнёров"));
        assertFalse(selection.isKnownContainer());
        assertNull(selection.selector());
        assertNull(selection.container());
    }

    @Test
    void fallsBackToWholeDocumentWhenNothingQualifies() {
        Document page = loader.load("<html><body><h1>Title</h1><p>First paragraph.</p></body></html>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.defaults()).select(page);

        assertEquals(ContentContainerSelector.Strategy.DOCUMENT, selection.strategy());
        assertSame(page, selection.content());
    }

    @Test
    void documentFallbackSkipsMainContentDetection() {
        ExtractionProperties properties = new ExtractionProperties();
        properties.setFallback(ContainerFallback.DOCUMENT);
        String paragraph = "Покупка оформлена в магазине у дома, чек сохранён, спасибо за то, что выбрали нас. ";
        Document page = loader.load("<body><article>" + ("<p>" + paragraph.repeat(2) + "</p>").repeat(4) + "</article></body>");

        ContentContainerSelector.Selection selection = selector(ExtractionRules.from(properties)).select(page);

        assertEquals(ContentContainerSelector.Strategy.DOCUMENT, selection.strategy());
        assertSame(page, selection.content());
    }
}
