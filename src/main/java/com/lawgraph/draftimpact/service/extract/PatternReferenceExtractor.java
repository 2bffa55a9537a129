package com.lawgraph.draftimpact.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds "section N" style references. A reference followed by "of title N", "of the ... Act"
 * or a U.S.C. citation points outside the document and is reported as external.
 */
@Component
@Slf4j
public class PatternReferenceExtractor implements ReferenceExtractor {

    private static final Pattern SECTION_REFERENCE = Pattern.compile(
            "(?i)(?:\\b(?:section|sec\\.)|§)\\s*(\\d+)([a-z])?\\b");

    private static final Pattern EXTERNAL_QUALIFIER = Pattern.compile(
            "(?i)^\\s*(?:\\([a-z0-9]+\\))*\\s*(?:of\\s+title\\s+\\d+|of\\s+the\\s+[A-Z][\\w\\s]*?Act|\\(\\d+\\s+U\\.S\\.C\\.)");

    @Override
    public List<ExtractedReference> extract(String provisionText) {
        List<ExtractedReference> references = new ArrayList<>();
        if (provisionText == null || provisionText.isBlank()) {
            return references;
        }

        Matcher matcher = SECTION_REFERENCE.matcher(provisionText);
        while (matcher.find()) {
            String remainder = provisionText.substring(matcher.end());
            boolean external = EXTERNAL_QUALIFIER.matcher(remainder).lookingAt();
            int number = parseNumber(matcher.group(1));
            references.add(new ExtractedReference(
                    external ? ReferenceKind.EXTERNAL : ReferenceKind.INTERNAL,
                    number,
                    matcher.group()));
        }

        log.debug("Extracted {} references", references.size());
        return references;
    }

    private int parseNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            log.debug("Section number out of range: {}", digits);
            return 0;
        }
    }
}
