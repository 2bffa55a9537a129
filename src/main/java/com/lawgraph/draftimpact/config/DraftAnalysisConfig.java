package com.lawgraph.draftimpact.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Tunable parameters for draft analysis.
 * Reads values from application.yml under {@code draft.analysis}; the field initializers
 * mirror the property defaults so plain unit tests can use {@link #defaults()}.
 */
@Configuration
@Slf4j
@Getter
@Setter
public class DraftAnalysisConfig {

    public static final String DEFAULT_BASE_URI = "https://regula.dev/regulations/";

    @Value("${draft.analysis.base-uri:" + DEFAULT_BASE_URI + "}")
    private String baseUri = DEFAULT_BASE_URI;

    @Value("${draft.analysis.jurisdiction-prefix:us-usc}")
    private String jurisdictionPrefix = "us-usc";

    @Value("${draft.analysis.impact-depth:3}")
    private int impactDepth = 3;

    @Value("${draft.analysis.description-max-length:200}")
    private int descriptionMaxLength = 200;

    @Value("${draft.analysis.duplicate-keyword-threshold:2}")
    private int duplicateKeywordThreshold = 2;

    // Gap heuristic: 6502 -> 6502A
    @Value("${draft.analysis.related-section.prefix-match:true}")
    private boolean relatedSectionPrefixMatch = true;

    // Gap heuristic: 6502 -> 6503 (same block of ten)
    @Value("${draft.analysis.related-section.block-match:true}")
    private boolean relatedSectionBlockMatch = true;

    @Value("${draft.analysis.risk.broken-reference-high:5}")
    private int brokenReferenceHighThreshold = 5;

    @Value("${draft.analysis.risk.affected-provisions-high:50}")
    private int affectedProvisionsHighThreshold = 50;

    public static DraftAnalysisConfig defaults() {
        return new DraftAnalysisConfig();
    }

    @PostConstruct
    void logSettings() {
        log.info("[Draft Analysis Config] baseUri={}, jurisdiction={}, impactDepth={}",
                baseUri, jurisdictionPrefix, impactDepth);
    }
}
