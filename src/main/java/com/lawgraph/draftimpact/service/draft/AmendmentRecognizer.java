package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import com.lawgraph.draftimpact.dto.draft.AmendmentType;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import com.lawgraph.draftimpact.dto.draft.DraftSection;
import com.lawgraph.draftimpact.dto.draft.TargetReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes amending directives in U.S. bill text.
 *
 * An "is amended" anchor opens a block whose target comes from the text before it. The block
 * is decomposed into numbered clauses "(1) ...", which may be scoped by "in subsection (x)"
 * and split into lettered items "(A) ...", which may in turn name a "paragraph (n)". Each
 * level narrows the target inherited from the level above. A repeal without any anchor is
 * recognized on its own.
 *
 * Stateless and safe for concurrent use.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AmendmentRecognizer {

    private static final String OPEN_QUOTE = "[\"“]";
    private static final String CLOSE_QUOTE = "[\"”]";
    private static final String UNIT = "(?:paragraph|subsection|section|subparagraph|clause)";

    // "(15 U.S.C. 6502)", "(15 U.S.C. 6505(d))", "(11 U.S.C. 101 et seq.)"
    private static final Pattern USC_CITATION = Pattern.compile(
            "\\((\\d+)\\s+U\\.S\\.C\\.\\s+(\\d+[a-z]?)(\\([a-z]\\)(?:\\(\\d+\\))*)?(?:\\s+et\\s+seq\\.)?\\)");

    private static final Pattern SECTION_REFERENCE = Pattern.compile(
            "(?i)Section\\s+(\\d+[a-zA-Z]?)(\\([a-z]\\)(?:\\(\\d+\\))*)?");

    private static final Pattern TITLE_REFERENCE = Pattern.compile(
            "(?i)(?:of\\s+)?title\\s+(\\d+)");

    // Directive patterns

    private static final Pattern STRIKE_INSERT = Pattern.compile(
            "(?i)(?:by\\s+)?striking\\s+" + OPEN_QUOTE + "([^\"”]+)" + CLOSE_QUOTE
                    + "\\s+and\\s+inserting\\s+" + OPEN_QUOTE + "([^\"”]+)" + CLOSE_QUOTE);

    private static final Pattern REPEAL = Pattern.compile(
            "(?i)is\\s+(?:hereby\\s+)?repealed");

    private static final Pattern ADD_NEW_SECTION = Pattern.compile(
            "(?i)(?:by\\s+)?inserting\\s+after\\s+(?:section|subsection)\\s+"
                    + "(\\([a-zA-Z0-9]+\\)|\\d+[a-zA-Z]?)\\s+the\\s+following\\s+new\\s+(?:section|subsection)");

    private static final Pattern ADD_AT_END = Pattern.compile(
            "(?i)(?:by\\s+)?adding\\s+at\\s+the\\s+end\\s+the\\s+following");

    private static final Pattern REDESIGNATE = Pattern.compile(
            "(?i)(?:by\\s+)?redesignating\\s+" + UNIT + "\\s+\\(([a-zA-Z0-9]+)\\)\\s+as\\s+"
                    + UNIT + "\\s+\\(([a-zA-Z0-9]+)\\)");

    private static final Pattern TABLE_OF_CONTENTS = Pattern.compile(
            "(?i)table\\s+of\\s+contents\\s+.{0,120}is\\s+amended");

    // Structure

    // "is amended--", its em-dash form, or "is amended by"
    private static final Pattern IS_AMENDED = Pattern.compile(
            "(?i)is\\s+amended\\s*[—\\-]{1,2}|is\\s+amended\\s+by\\b");

    private static final Pattern NUMBERED_CLAUSE = Pattern.compile("(?m)^\\s+\\((\\d+)\\)\\s");

    private static final Pattern LETTERED_CLAUSE = Pattern.compile("(?m)^\\s+\\(([A-Z])\\)\\s");

    private static final Pattern IN_SUBSECTION = Pattern.compile(
            "(?i)(?:in(?:tes\\s+in)?)\\s+subsection\\s+\\(([a-z])\\)");

    private static final Pattern PARAGRAPH_REFERENCE = Pattern.compile(
            "(?i)(?:in\\s+)?paragraph\\s+\\((\\d+[A-Za-z]*)\\)");

    private static final Pattern QUOTED_BLOCK = Pattern.compile(OPEN_QUOTE + "(.+)" + CLOSE_QUOTE);

    /**
     * Evaluated top to bottom; the first match wins, so the generic repeal test comes last.
     */
    private static final List<DirectiveRule> DIRECTIVE_RULES = List.of(
            new DirectiveRule(STRIKE_INSERT, AmendmentType.STRIKE_INSERT),
            new DirectiveRule(REDESIGNATE, AmendmentType.REDESIGNATE),
            new DirectiveRule(TABLE_OF_CONTENTS, AmendmentType.TABLE_OF_CONTENTS),
            new DirectiveRule(ADD_NEW_SECTION, AmendmentType.ADD_NEW_SECTION),
            new DirectiveRule(ADD_AT_END, AmendmentType.ADD_AT_END),
            new DirectiveRule(REPEAL, AmendmentType.REPEAL)
    );

    private final DraftAnalysisConfig config;

    /**
     * Extract every amendment in a section's text. Text without directives yields an empty list.
     */
    public List<Amendment> extractAmendments(String sectionText) {
        List<Amendment> amendments = new ArrayList<>();
        if (sectionText == null || sectionText.isBlank()) {
            return amendments;
        }

        extractStandaloneRepeal(sectionText).ifPresent(amendments::add);

        List<int[]> anchors = new ArrayList<>();
        Matcher anchorMatcher = IS_AMENDED.matcher(sectionText);
        while (anchorMatcher.find()) {
            anchors.add(new int[]{anchorMatcher.start(), anchorMatcher.end()});
        }

        for (int i = 0; i < anchors.size(); i++) {
            int[] anchor = anchors.get(i);
            int blockEnd = i + 1 < anchors.size()
                    ? findPreambleStart(sectionText, anchors.get(i + 1)[0])
                    : sectionText.length();
            // A preamble that swallows the anchor itself leaves no block body
            if (blockEnd < anchor[1]) {
                blockEnd = anchor[1];
            }

            String block = sectionText.substring(anchor[1], blockEnd);

            // Later anchors read their own preamble first so an earlier citation does not win
            Optional<TargetReference> target = Optional.empty();
            if (i > 0) {
                target = parseTargetReference(sectionText.substring(findPreambleStart(sectionText, anchor[0]), anchor[0]));
            }
            if (target.isEmpty()) {
                target = parseTargetReference(sectionText.substring(0, anchor[0]));
            }
            if (target.isEmpty()) {
                log.debug("No target reference before amending anchor at offset {}", anchor[0]);
                continue;
            }
            extractBlock(block, target.get(), amendments);
        }

        log.debug("Recognized {} amendments across {} anchors", amendments.size(), anchors.size());
        return amendments;
    }

    /**
     * Fill in the amendment list of every section of a bill.
     */
    public DraftBill annotateBill(DraftBill bill) {
        int total = 0;
        for (DraftSection section : bill.getSections()) {
            List<Amendment> amendments = extractAmendments(section.getRawText());
            section.setAmendments(amendments);
            total += amendments.size();
        }
        log.info("Recognized {} amendments in {} sections of {}", total, bill.getSections().size(),
                bill.getBillNumber());
        return bill;
    }

    /**
     * @return the kind of the first matching directive pattern, or empty if none matches
     */
    public Optional<AmendmentType> classifyAmendmentType(String text) {
        String normalized = normalize(text);
        for (DirectiveRule rule : DIRECTIVE_RULES) {
            if (rule.pattern.matcher(normalized).find()) {
                return Optional.of(rule.type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve the statutory target of a passage: a U.S.C. citation, else "Section N ... title T",
     * else a bare "title T".
     */
    public Optional<TargetReference> parseTargetReference(String text) {
        String normalized = normalize(text);

        Matcher citation = USC_CITATION.matcher(normalized);
        if (citation.find()) {
            return Optional.of(new TargetReference(citation.group(1), citation.group(2), orEmpty(citation.group(3))));
        }

        Matcher section = SECTION_REFERENCE.matcher(normalized);
        Matcher title = TITLE_REFERENCE.matcher(normalized);
        boolean hasSection = section.find();
        boolean hasTitle = title.find();

        if (hasSection && hasTitle) {
            return Optional.of(new TargetReference(title.group(1), section.group(1), orEmpty(section.group(2))));
        }
        if (hasTitle) {
            return Optional.of(new TargetReference(title.group(1), "", ""));
        }
        return Optional.empty();
    }

    // ========================= BLOCK DECOMPOSITION =========================

    private void extractBlock(String block, TargetReference target, List<Amendment> sink) {
        List<Span> clauses = splitSpans(NUMBERED_CLAUSE, block);
        if (clauses.isEmpty()) {
            addIfRecognized(block, target, sink);
            return;
        }

        // Inline edit ahead of the numbered list stands alone; the list is not its sub-items
        int firstClauseStart = block.indexOf("(" + clauses.get(0).label + ")");
        if (firstClauseStart > 0) {
            String lead = block.substring(0, firstClauseStart);
            if (classifyAmendmentType(lead).isPresent()) {
                addIfRecognized(lead, target, sink);
                return;
            }
        }

        for (Span clause : clauses) {
            extractClause(clause.text, target, sink);
        }
    }

    private void extractClause(String clauseText, TargetReference target, List<Amendment> sink) {
        Matcher scope = IN_SUBSECTION.matcher(clauseText);
        if (!scope.find()) {
            addIfRecognized(clauseText, target, sink);
            return;
        }

        TargetReference scoped = target.withSubsection("(" + scope.group(1) + ")");
        List<Span> items = splitSpans(LETTERED_CLAUSE, clauseText);
        if (items.isEmpty()) {
            addIfRecognized(clauseText, scoped, sink);
            return;
        }

        for (Span item : items) {
            addIfRecognized(item.text, narrowToParagraph(item.text, scoped), sink);
        }
    }

    private TargetReference narrowToParagraph(String itemText, TargetReference scoped) {
        Matcher paragraph = PARAGRAPH_REFERENCE.matcher(itemText);
        if (paragraph.find()) {
            return scoped.withSubsection(scoped.getSubsection() + "(" + paragraph.group(1) + ")");
        }
        return scoped;
    }

    private void addIfRecognized(String text, TargetReference target, List<Amendment> sink) {
        buildAmendment(text, target).ifPresent(sink::add);
    }

    private Optional<Amendment> extractStandaloneRepeal(String sectionText) {
        String normalized = normalize(sectionText);
        if (!REPEAL.matcher(normalized).find() || IS_AMENDED.matcher(sectionText).find()) {
            return Optional.empty();
        }
        return parseTargetReference(normalized).map(target -> Amendment.builder()
                .type(AmendmentType.REPEAL)
                .targetTitle(target.getTitle())
                .targetSection(target.getSection())
                .targetSubsection(target.getSubsection())
                .description(truncate(normalized))
                .build());
    }

    private Optional<Amendment> buildAmendment(String clauseText, TargetReference target) {
        Optional<AmendmentType> type = classifyAmendmentType(clauseText);
        if (type.isEmpty()) {
            return Optional.empty();
        }

        Amendment.AmendmentBuilder amendment = Amendment.builder()
                .type(type.get())
                .targetTitle(target.getTitle())
                .targetSection(target.getSection())
                .targetSubsection(target.getSubsection())
                .description(truncate(clauseText));

        switch (type.get()) {
            case STRIKE_INSERT -> {
                Matcher strike = STRIKE_INSERT.matcher(normalize(clauseText));
                if (strike.find()) {
                    amendment.strikeText(strike.group(1)).insertText(strike.group(2));
                }
            }
            case ADD_AT_END, ADD_NEW_SECTION -> amendment.insertText(extractQuotedInsertText(clauseText));
            case REDESIGNATE -> {
                Matcher redesignate = REDESIGNATE.matcher(normalize(clauseText));
                if (redesignate.find()) {
                    amendment.strikeText("(" + redesignate.group(1) + ")")
                            .insertText("(" + redesignate.group(2) + ")");
                }
            }
            default -> {
            }
        }
        return Optional.of(amendment.build());
    }

    // ========================= TEXT HELPERS =========================

    /**
     * Start of the preamble leading up to an anchor: back to the start of the anchor's line,
     * then up through continuation lines until a blank line or a line opening a clause.
     */
    static int findPreambleStart(String text, int anchorStart) {
        int pos = anchorStart;
        while (pos > 0 && text.charAt(pos - 1) != '\n') {
            pos--;
        }
        while (pos > 0) {
            int prevLineEnd = pos - 1;
            int prevLineStart = prevLineEnd;
            while (prevLineStart > 0 && text.charAt(prevLineStart - 1) != '\n') {
                prevLineStart--;
            }
            String prevLine = text.substring(prevLineStart, prevLineEnd).trim();
            if (prevLine.isEmpty()) {
                break;
            }
            pos = prevLineStart;
            if (prevLine.charAt(0) == '(') {
                break;
            }
        }
        return pos;
    }

    private static List<Span> splitSpans(Pattern boundary, String text) {
        List<Integer> starts = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        Matcher matcher = boundary.matcher(text);
        while (matcher.find()) {
            starts.add(matcher.start());
            labels.add(matcher.group(1));
        }

        List<Span> spans = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
            spans.add(new Span(labels.get(i), text.substring(starts.get(i), end).trim()));
        }
        return spans;
    }

    private static String extractQuotedInsertText(String text) {
        int colon = Math.max(text.lastIndexOf(':'), 0);
        Matcher quoted = QUOTED_BLOCK.matcher(normalize(text.substring(colon)));
        return quoted.find() ? quoted.group(1) : "";
    }

    private String truncate(String text) {
        String normalized = normalize(text);
        int max = config.getDescriptionMaxLength();
        if (normalized.length() > max) {
            return normalized.substring(0, max) + "...";
        }
        return normalized;
    }

    static String normalize(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? "" : String.join(" ", trimmed.split("\\s+"));
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static final class DirectiveRule {
        private final Pattern pattern;
        private final AmendmentType type;

        private DirectiveRule(Pattern pattern, AmendmentType type) {
            this.pattern = pattern;
            this.type = type;
        }
    }

    private static final class Span {
        private final String label;
        private final String text;

        private Span(String label, String text) {
            this.label = label;
            this.text = text;
        }
    }
}
