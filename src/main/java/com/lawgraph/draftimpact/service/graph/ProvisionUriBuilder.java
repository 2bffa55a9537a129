package com.lawgraph.draftimpact.service.graph;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Builds the identifiers amendment targets resolve to. These must agree with how
 * documents were named and minted at ingestion time.
 *
 * Format Rules:
 * - Document: {jurisdiction}-title-{N}, lowercase (e.g. us-usc-title-15)
 * - Regulation: {base}{DOCUMENT-ID}
 * - Provision: {base}{DOCUMENT-ID}:Art{section}[({subsection})]
 * - Right: {base}{DOCUMENT-ID}:Right:{section}:{rightType}
 * - Obligation: {base}{DOCUMENT-ID}:Obligation:{section}:{obligationType}
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProvisionUriBuilder {

    private final DraftAnalysisConfig config;

    public String documentId(String titleNumber) {
        return (config.getJurisdictionPrefix() + "-title-" + titleNumber.trim()).toLowerCase(Locale.ROOT);
    }

    /**
     * Falls back to the configured base when the library reports none, and guarantees a
     * trailing separator.
     */
    public String normalizeBaseUri(String libraryBaseUri) {
        String base = libraryBaseUri == null || libraryBaseUri.isEmpty() ? config.getBaseUri() : libraryBaseUri;
        if (!base.endsWith("/") && !base.endsWith("#")) {
            base += "/";
        }
        return base;
    }

    public String regulationUri(String baseUri, String documentId) {
        return baseUri + documentId.toUpperCase(Locale.ROOT);
    }

    public String provisionUri(String baseUri, String documentId, String section, String subsection) {
        StringBuilder uri = new StringBuilder(regulationUri(baseUri, documentId))
                .append(":Art")
                .append(section);
        if (subsection != null && !subsection.isEmpty()) {
            // Recognized subsections already carry their parentheses, e.g. "(b)(2)"
            if (subsection.startsWith("(")) {
                uri.append(subsection);
            } else {
                uri.append('(').append(subsection).append(')');
            }
        }
        return uri.toString();
    }

    public String articleUri(String baseUri, String documentId, int articleNumber) {
        return regulationUri(baseUri, documentId) + ":Art" + articleNumber;
    }

    public String rightUri(String baseUri, String documentId, String section, String rightType) {
        return String.format("%s:Right:%s:%s", regulationUri(baseUri, documentId), section, rightType);
    }

    public String obligationUri(String baseUri, String documentId, String section, String obligationType) {
        return String.format("%s:Obligation:%s:%s", regulationUri(baseUri, documentId), section, obligationType);
    }

    /**
     * Human readable target used for unresolved amendments, e.g. "15 U.S.C. 6502(b)".
     */
    public String describeTarget(Amendment amendment) {
        StringBuilder description = new StringBuilder()
                .append(amendment.getTargetTitle())
                .append(" U.S.C. ")
                .append(amendment.getTargetSection());
        if (amendment.hasSubsection()) {
            String subsection = amendment.getTargetSubsection();
            description.append(subsection.startsWith("(") ? subsection : "(" + subsection + ")");
        }
        return description.toString();
    }
}
