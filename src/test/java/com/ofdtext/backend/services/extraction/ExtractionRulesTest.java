package com.ofdtext.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.ofdtext.backend.config.ExtractionProperties;

class ExtractionRulesTest {

    @Test
    void defaultsDescribeOfdReceiptPages() {
        ExtractionRules rules = ExtractionRules.defaults();

        assertEquals(List.of(
                new ExtractionRules.ContainerRule("#fido_cheque_container", true),
                new ExtractionRules.ContainerRule(".check_ctn", false),
                new ExtractionRules.ContainerRule(".js__cheque_fido_constructor", true)
        ), rules.containers());
        assertEquals(100, rules.encodedMinLength());
        assertEquals(ContainerFallback.MAIN_CONTENT, rules.fallback());
        assertFalse(rules.decodeEntitiesBeforeParse());
        assertEquals("--- Ссылки ---", rules.trailer().header());
    }

    @Test
    void noisePatternsIgnoreCaseForCyrillic() {
        ExtractionRules rules = ExtractionRules.defaults();

        assertTrue(rules.noisePatterns().stream().anyMatch(p -> p.matcher("ЗАБРАТЬ").find()));
        assertTrue(rules.noisePatterns().stream().anyMatch(p -> p.matcher("вам ДОСТУПЕН (2) подарок за покупку").find()));
    }

    @Test
    void overriddenListsReplaceDefaults() {
        ExtractionProperties properties = new ExtractionProperties();
        properties.setNoisePatterns(List.of("Реклама"));
        properties.setTrackingUrlPatterns(List.of("ads\\.example"));

        ExtractionRules rules = ExtractionRules.from(properties);

        assertEquals(1, rules.noisePatterns().size());
        assertEquals("ads\\.example", rules.trackingUrlPatterns().get(0).pattern());
    }

    @Test
    void invalidSelectorFailsEarly() {
        ExtractionProperties properties = new ExtractionProperties();
        properties.setBlockSelectors(List.of("div:no-such-pseudo"));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ExtractionRules.from(properties));
        assertTrue(e.getMessage().contains("div:no-such-pseudo"));
    }

    @Test
    void rulesAreImmutable() {
        ExtractionRules rules = ExtractionRules.defaults();

        assertThrows(UnsupportedOperationException.class, () -> rules.unwantedTags().add("p"));
        assertThrows(UnsupportedOperationException.class, () -> rules.containers().clear());
    }
}
