package com.ofdtext.backend.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.ofdtext.backend.services.extraction.ContainerFallback;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Extraction rules, bound from the "extractor" prefix.
 *
 * Every default reproduces the rules the service was tuned with for OFD receipt pages
 * (platformaofd.ru), so the application runs without any extractor.* property set.
 * Overriding a list property replaces the whole default list.
 *
 * Example:
 * extractor.fallback=DOCUMENT
 * extractor.containers[0].selector=#fido_cheque_container
 * extractor.containers[0].encoded=true
 * extractor.tracking-url-patterns[0]=mc\\.yandex\\.ru
 */
@Data
@Validated
@ConfigurationProperties(prefix = "extractor")
public class ExtractionProperties {

    /**
     * Known receipt containers, most specific first.
     */
    @Valid
    @NotNull
    private List<ContainerRule> containers = new ArrayList<>(List.of(
            new ContainerRule("#fido_cheque_container", true),
            new ContainerRule(".check_ctn", false),
            new ContainerRule(".js__cheque_fido_constructor", true)
    ));

    /**
     * An encoded container is only used when its text is longer than this.
     */
    @Min(0)
    private int encodedMinLength = 100;

    /**
     * What to extract from when no container matches.
     */
    @NotNull
    private ContainerFallback fallback = ContainerFallback.MAIN_CONTENT;

    /**
     * HTML-unescape the whole input before parsing it.
     */
    private boolean decodeEntitiesBeforeParse = false;

    @Valid
    @NotNull
    private MainContent mainContent = new MainContent();

    @Valid
    @NotNull
    private Links links = new Links();

    @NotNull
    private List<String> unwantedTags = new ArrayList<>(List.of(
            "script", "style", "meta", "link", "noscript", "iframe", "svg", "img"
    ));

    /**
     * CSS selectors of advertising blocks removed together with the unwanted tags.
     */
    @NotNull
    private List<String> blockSelectors = new ArrayList<>();

    @NotNull
    private List<String> trackingUrlPatterns = new ArrayList<>(List.of(
            "urlstats\\.platformaofd\\.ru",
            "share\\.floctory\\.com",
            "cdn1\\.platformaofd\\.ru/checkmarketing",
            "cdn1\\.platformaofd\\.ru/fido-constructor",
            "page\\.link",
            "mc\\.yandex\\.ru",
            "jivosite\\.com",
            "besteml\\.com"
    ));

    @NotNull
    private List<String> keepUrlPatterns = new ArrayList<>(List.of(
            "/web/noauth/cheque/pdf",
            "nalog\\.gov\\.ru",
            "platformaofd\\.ru/web/noauth/cheque/search"
    ));

    /**
     * Promotional phrases and decorative alt-texts, applied in order, case-insensitive.
     */
    @NotNull
    private List<String> noisePatterns = new ArrayList<>(List.of(
            "Вам подарки за проведенную оплату!?",
            "Вам доступен \\(\\d+\\) подарок за покупку!?",
            "Подарок за оплату\\s*",
            "Выбрать подарок\\s*",
            "Забрать\\s*",
            "Активировать\\s*",
            "Ваш подарок за покупку неактивен\\s*",
            "волна",
            "Картинка",
            "⭐️[^⭐]*⭐️"
    ));

    @Valid
    @NotNull
    private Trailer trailer = new Trailer();

    @Valid
    @NotNull
    private Debug debug = new Debug();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContainerRule {

        @NotBlank
        private String selector;

        /**
         * The container's text is HTML-unescaped and parsed again, and it only counts
         * when that text is longer than encodedMinLength.
         */
        private boolean encoded;
    }

    @Data
    public static class MainContent {

        /**
         * Minimum text length of the readability result; shorter results fall back to the whole document.
         */
        @Min(1)
        private int minTextLength = 250;

        /**
         * Base URI handed to Readability4J for resolving relative links; the pages arrive without their URL.
         */
        @NotBlank
        private String baseUri = "http://localhost/";
    }

    @Data
    public static class Links {

        @NotBlank
        private String pdfMarker = "/cheque/pdf";

        /**
         * Checked case-insensitively; keeps the offer (oferta) PDF out of the pdf slot.
         */
        @NotBlank
        private String pdfExclusion = "oferta";

        @NotBlank
        private String verificationMarker = "nalog.gov.ru";
    }

    @Data
    public static class Trailer {

        @NotBlank
        private String header = "--- Ссылки ---";

        @NotBlank
        private String pdfLabel = "PDF чека";

        @NotBlank
        private String verificationLabel = "Проверка ФНС";
    }

    @Data
    public static class Debug {

        private boolean logExtractedText = false;

        @Min(0)
        private int extractedTextMaxChars = 2000;
    }
}
