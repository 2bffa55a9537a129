package com.lawgraph.draftimpact.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Table-driven recognizer for common privacy-law rights and duties.
 * Each rule fires at most once per text; the first match supplies the matched text.
 */
@Component
@Slf4j
public class PatternSemanticExtractor implements SemanticExtractor {

    private static final List<Rule> RULES = List.of(
            // Rights
            right("(?i)right\\s+(?:of\\s+|to\\s+)?access", "RightOfAccess"),
            right("(?i)right\\s+to\\s+(?:obtain\\s+)?rectification", "RightToRectification"),
            right("(?i)right\\s+to\\s+(?:obtain\\s+)?erasure|right\\s+to\\s+be\\s+forgotten", "RightToErasure"),
            right("(?i)right\\s+to\\s+data\\s+portability", "RightToDataPortability"),
            right("(?i)right\\s+to\\s+object", "RightToObject"),
            right("(?i)right\\s+to\\s+(?:obtain\\s+|receive\\s+)?(?:the\\s+)?information", "RightToInformation"),
            right("(?i)right\\s+to\\s+(?:request\\s+)?delet(?:e|ion)", "RightToDelete"),
            right("(?i)right\\s+(?:to\\s+)?opt[- ]?out", "RightToOptOut"),
            right("(?i)right\\s+to\\s+(?:request\\s+)?correct(?:ion)?", "RightToCorrect"),

            // Prohibitions
            prohibition("(?i)(?:shall|must|may)\\s+not\\s+(?:sell|disclose|share)[^.;]*", "NondisclosureObligation"),
            prohibition("(?i)(?:shall|must)\\s+not\\s+discriminate[^.;]*", "NonDiscriminationObligation"),

            // Obligations
            obligation("(?i)notify\\s+(?:the\\s+)?(?:personal\\s+data\\s+)?breach[^.;]*", "BreachNotificationObligation"),
            obligation("(?i)(?:shall|must)\\s+implement\\s+(?:appropriate\\s+)?(?:technical\\s+and\\s+organi[sz]ational\\s+)?(?:security\\s+)?measures[^.;]*",
                    "SecurityObligation"),
            obligation("(?i)(?:shall|must)\\s+(?:maintain|retain|preserve)\\s+(?:a\\s+)?records?[^.;]*", "RecordKeepingObligation"),
            obligation("(?i)(?:shall|must)\\s+provide\\s+(?:the\\s+)?(?:following\\s+)?information[^.;]*",
                    "InformationProvisionObligation"),
            obligation("(?i)(?:shall|must)\\s+(?:provide|give)\\s+(?:clear\\s+)?notice[^.;]*", "TransparencyObligation"),
            obligation("(?i)(?:shall\\s+)?(?:not\\s+)?collect[^.;]*(?:more\\s+than|necessary|reasonably)[^.;]*",
                    "DataMinimizationObligation"),
            obligation("(?i)(?:shall|must)\\s+(?:verify|establish[^.;]*verify)[^.;]*", "VerificationObligation")
    );

    @Override
    public List<SemanticAnnotation> extract(String provisionText) {
        List<SemanticAnnotation> annotations = new ArrayList<>();
        if (provisionText == null || provisionText.isBlank()) {
            return annotations;
        }

        String normalized = String.join(" ", provisionText.trim().split("\\s+"));
        Set<String> seenTypes = new HashSet<>();

        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern.matcher(normalized);
            if (!matcher.find() || !seenTypes.add(rule.kind + ":" + rule.typeName)) {
                continue;
            }
            SemanticAnnotation.SemanticAnnotationBuilder annotation = SemanticAnnotation.builder()
                    .kind(rule.kind)
                    .matchedText(matcher.group().trim());
            if (rule.kind == SemanticKind.RIGHT) {
                annotation.rightType(rule.typeName);
            } else {
                annotation.obligationType(rule.typeName);
            }
            annotations.add(annotation.build());
        }

        log.debug("Extracted {} semantic annotations", annotations.size());
        return annotations;
    }

    private static Rule right(String regex, String rightType) {
        return new Rule(Pattern.compile(regex), SemanticKind.RIGHT, rightType);
    }

    private static Rule obligation(String regex, String obligationType) {
        return new Rule(Pattern.compile(regex), SemanticKind.OBLIGATION, obligationType);
    }

    private static Rule prohibition(String regex, String obligationType) {
        return new Rule(Pattern.compile(regex), SemanticKind.PROHIBITION, obligationType);
    }

    private static final class Rule {
        private final Pattern pattern;
        private final SemanticKind kind;
        private final String typeName;

        private Rule(Pattern pattern, SemanticKind kind, String typeName) {
            this.pattern = pattern;
            this.kind = kind;
            this.typeName = typeName;
        }
    }
}
