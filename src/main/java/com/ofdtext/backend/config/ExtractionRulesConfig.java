package com.ofdtext.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.ofdtext.backend.services.extraction.ExtractionRules;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class ExtractionRulesConfig {

    // Compiled once; every request shares the same immutable tables.
    @Bean
    public ExtractionRules extractionRules(ExtractionProperties properties) {
        ExtractionRules rules = ExtractionRules.from(properties);
        log.info("[ExtractionRules] {} containers, fallback={}, {} tracking / {} keep / {} noise patterns",
                rules.containers().size(),
                rules.fallback(),
                rules.trackingUrlPatterns().size(),
                rules.keepUrlPatterns().size(),
                rules.noisePatterns().size());
        return rules;
    }
}
