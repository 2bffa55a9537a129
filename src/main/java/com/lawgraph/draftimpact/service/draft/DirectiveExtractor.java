package com.lawgraph.draftimpact.service.draft;

import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls directive phrases ("shall not disclose ...", "must provide ...") out of legal text.
 * The bare "shall" and "must" patterns skip a following "not", so a negated sentence yields
 * only its negated directive.
 */
final class DirectiveExtractor {

    private DirectiveExtractor() {
    }

    private static final List<Pattern> DIRECTIVE_PATTERNS = List.of(
            Pattern.compile("(?i)\\b(shall\\s+not)\\b\\s+(.+?)(?:[.;]|$)"),
            Pattern.compile("(?i)\\b(must\\s+not)\\b\\s+(.+?)(?:[.;]|$)"),
            Pattern.compile("(?i)\\b(may\\s+not)\\b\\s+(.+?)(?:[.;]|$)"),
            Pattern.compile("(?i)\\b(is\\s+prohibited\\s+from)\\b\\s+(.+?)(?:[.;]|$)"),
            Pattern.compile("(?i)\\b(shall)\\b(?!\\s+not\\b)\\s+(.+?)(?:[.;]|$)"),
            Pattern.compile("(?i)\\b(must)\\b(?!\\s+not\\b)\\s+(.+?)(?:[.;]|$)"),
            Pattern.compile("(?i)\\b(is\\s+required\\s+to)\\b\\s+(.+?)(?:[.;]|$)")
    );

    private static final Set<String> NEGATED_VERBS = Set.of(
            "shall not", "must not", "may not", "is prohibited from");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "to", "in", "for", "and", "or", "with",
            "be", "by", "on", "at", "from", "as", "is", "it", "that", "this",
            "any", "all", "each", "such");

    private static final String TRIM_CHARS = ".,;:()\"'";

    @Value
    static class Directive {
        String verb;
        boolean negated;
        List<String> keywords;

        boolean contradicts(Directive other) {
            if (keywords.isEmpty() || other.keywords.isEmpty()) {
                return false;
            }
            if (negated == other.negated) {
                return false;
            }
            Set<String> mine = new HashSet<>(keywords);
            for (String keyword : other.keywords) {
                if (mine.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }

        boolean duplicates(Directive other, int threshold) {
            if (negated != other.negated || keywords.isEmpty() || other.keywords.isEmpty()) {
                return false;
            }
            Set<String> mine = new HashSet<>(keywords);
            int shared = 0;
            for (String keyword : other.keywords) {
                if (mine.contains(keyword)) {
                    shared++;
                }
            }
            return shared >= threshold;
        }
    }

    static List<Directive> extract(String text) {
        List<Directive> directives = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return directives;
        }
        String normalized = String.join(" ", text.trim().split("\\s+"));

        for (Pattern pattern : DIRECTIVE_PATTERNS) {
            Matcher m = pattern.matcher(normalized);
            while (m.find()) {
                String verb = m.group(1).trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
                String subject = m.group(2).trim().toLowerCase(Locale.ROOT);
                directives.add(new Directive(verb, NEGATED_VERBS.contains(verb), subjectKeywords(subject)));
            }
        }
        return directives;
    }

    static boolean anyContradiction(List<Directive> left, List<Directive> right) {
        for (Directive a : left) {
            for (Directive b : right) {
                if (a.contradicts(b)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean anyDuplicate(List<Directive> left, List<Directive> right, int threshold) {
        for (Directive a : left) {
            for (Directive b : right) {
                if (a.duplicates(b, threshold)) {
                    return true;
                }
            }
        }
        return false;
    }

    static List<String> subjectKeywords(String text) {
        List<String> keywords = new ArrayList<>();
        for (String word : text.split("\\s+")) {
            String cleaned = trim(word);
            if (cleaned.length() > 2 && !STOP_WORDS.contains(cleaned)) {
                keywords.add(cleaned);
            }
        }
        return keywords;
    }

    private static String trim(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && TRIM_CHARS.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIM_CHARS.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }
}
