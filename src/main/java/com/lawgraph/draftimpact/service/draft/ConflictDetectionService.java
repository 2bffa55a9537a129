package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.finding.Conflict;
import com.lawgraph.draftimpact.dto.finding.ConflictReport;
import com.lawgraph.draftimpact.dto.finding.ConflictSummary;
import com.lawgraph.draftimpact.dto.finding.ConflictType;
import com.lawgraph.draftimpact.dto.finding.Finding;
import com.lawgraph.draftimpact.dto.finding.Severity;
import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.Triple;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.DraftLibraryOpener;
import com.lawgraph.draftimpact.service.draft.DirectiveExtractor.Directive;
import com.lawgraph.draftimpact.service.graph.ProvisionLabels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects semantic conflicts between a bill's amendments and the obligations and rights already
 * in the graph.
 *
 * Obligation checks: modified provisions are tested for contradicting directives, repealed
 * provisions for obligations other provisions still depend on, and added provisions for
 * duplicates of existing obligations. Rights checks: narrowing on modified provisions, repealed
 * rights with dependents, new rights that clash with existing obligations, and new rights that
 * the graph does not know yet.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConflictDetectionService {

    private static final List<String> NARROWING_QUALIFIERS = List.of(
            "except when", "except where", "except in cases", "unless", "provided that",
            "subject to", "limited to", "only if", "only when", "only where",
            "shall not apply", "does not apply", "notwithstanding", "restricted to", "may not exercise");

    private static final List<String> RIGHT_GRANTING_PHRASES = List.of(
            "has the right", "shall have the right", "is entitled to", "shall be entitled",
            "may request", "may obtain", "right to access", "right to erasure",
            "right to rectification", "right to object", "right to data portability");

    private static final List<Pattern> RIGHT_KEYWORD_PATTERNS = List.of(
            Pattern.compile("(?i)right\\s+to\\s+(\\w+(?:\\s+\\w+)?)"),
            Pattern.compile("(?i)right\\s+of\\s+(\\w+(?:\\s+\\w+)?)"),
            Pattern.compile("(?i)entitled\\s+to\\s+(\\w+(?:\\s+\\w+)?)"),
            Pattern.compile("(?i)may\\s+(access|request|obtain|transfer|object|refuse|erasure|rectif\\w+|portability)")
    );

    // Right terms on the left, obligation terms that restrict them on the right
    private static final List<List<List<String>>> RIGHTS_OBLIGATION_CONFLICT_PAIRS = List.of(
            List.of(List.of("access", "information", "disclosure"),
                    List.of("minimization", "restrict", "confidential", "nondisclosure")),
            List.of(List.of("erasure", "deletion", "forget"),
                    List.of("retention", "preserve", "record", "maintain")),
            List.of(List.of("portability", "transfer", "export"),
                    List.of("localization", "restrict transfer", "restrict export")),
            List.of(List.of("object", "refuse", "opt out"),
                    List.of("mandatory", "compulsory", "required participation"))
    );

    private final DraftLibraryOpener libraryOpener;
    private final DraftAnalysisConfig config;

    // ===== ENTRY POINTS =====

    public ConflictReport detectConflicts(DraftDiff diff, String libraryPath) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        return detectConflicts(diff, libraryOpener.open(libraryPath));
    }

    /**
     * Obligation and rights conflicts merged into one sorted report.
     */
    public ConflictReport detectConflicts(DraftDiff diff, DraftLibrary library) {
        ConflictReport report = detectObligationConflicts(diff, library);
        List<Conflict> all = new ArrayList<>(report.getConflicts());
        all.addAll(detectRightsConflicts(diff, library));
        all.sort(Finding.ORDER);

        report.setConflicts(all);
        report.setSummary(ConflictSummary.of(all));
        log.info("Conflict detection complete: {} conflicts ({} errors, {} warnings, {} infos)",
                all.size(), report.getSummary().getErrors(), report.getSummary().getWarnings(),
                report.getSummary().getInfos());
        all.forEach(c -> log.debug("[{}] {} at {}: {}", c.severityLabel(), c.typeLabel(), c.nodeId(), c.getDescription()));
        return report;
    }

    public ConflictReport detectObligationConflicts(DraftDiff diff, DraftLibrary library) {
        requireInputs(diff, library);
        GraphSnapshotCache snapshots = new GraphSnapshotCache(library);
        List<Conflict> conflicts = new ArrayList<>();

        for (DiffEntry entry : diff.getModified()) {
            snapshots.tryLoad(entry.getTargetDocumentId())
                    .ifPresent(store -> conflicts.addAll(findContradictions(entry, store)));
        }
        for (DiffEntry entry : diff.getRemoved()) {
            snapshots.tryLoad(entry.getTargetDocumentId())
                    .ifPresent(store -> conflicts.addAll(findOrphanedObligations(entry, store)));
        }
        for (DiffEntry entry : diff.getAdded()) {
            snapshots.tryLoad(entry.getTargetDocumentId())
                    .ifPresent(store -> conflicts.addAll(findDuplicateObligations(entry, store)));
        }

        conflicts.sort(Finding.ORDER);
        log.debug("Found {} obligation conflicts", conflicts.size());
        return ConflictReport.builder()
                .bill(diff.getBill())
                .conflicts(conflicts)
                .summary(ConflictSummary.of(conflicts))
                .build();
    }

    public List<Conflict> detectRightsConflicts(DraftDiff diff, DraftLibrary library) {
        requireInputs(diff, library);
        GraphSnapshotCache snapshots = new GraphSnapshotCache(library);
        List<Conflict> conflicts = new ArrayList<>();

        for (DiffEntry entry : diff.getModified()) {
            snapshots.tryLoad(entry.getTargetDocumentId())
                    .ifPresent(store -> conflicts.addAll(findRightsNarrowing(entry, store)));
        }
        for (DiffEntry entry : diff.getRemoved()) {
            snapshots.tryLoad(entry.getTargetDocumentId())
                    .ifPresent(store -> conflicts.addAll(findRepealedRights(entry, store)));
        }
        for (DiffEntry entry : diff.getAdded()) {
            snapshots.tryLoad(entry.getTargetDocumentId()).ifPresent(store -> {
                conflicts.addAll(findRightsObligationConflicts(entry, store));
                conflicts.addAll(findRightsExpansion(entry, store));
            });
        }

        conflicts.sort(Finding.ORDER);
        log.debug("Found {} rights conflicts", conflicts.size());
        return conflicts;
    }

    // ===== PURE CLASSIFIERS =====

    public static Severity classifySeverity(ConflictType type) {
        if (type == null) {
            return Severity.WARNING;
        }
        return switch (type) {
            case OBLIGATION_CONTRADICTION, RIGHTS_CONTRADICTION -> Severity.ERROR;
            case OBLIGATION_ORPHANED, RIGHTS_NARROWING -> Severity.WARNING;
            case OBLIGATION_DUPLICATE, RIGHTS_EXPANSION -> Severity.INFO;
        };
    }

    /**
     * True when a directive in one text opposes a directive in the other on a shared subject keyword.
     */
    public static boolean detectObligationContradiction(String proposedText, String existingText) {
        return DirectiveExtractor.anyContradiction(
                DirectiveExtractor.extract(proposedText), DirectiveExtractor.extract(existingText));
    }

    /**
     * True when the proposed text adds a limiting qualifier or drops right-granting language.
     */
    public static boolean detectRightsNarrowing(String existingRight, String proposedText) {
        String existing = normalizeLower(existingRight);
        String proposed = normalizeLower(proposedText);

        for (String qualifier : NARROWING_QUALIFIERS) {
            if (proposed.contains(qualifier) && !existing.contains(qualifier)) {
                return true;
            }
        }
        for (String phrase : RIGHT_GRANTING_PHRASES) {
            if (existing.contains(phrase) && !proposed.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public static boolean detectRightsObligationConflict(String rightKeyword, String obligationType) {
        String right = rightKeyword.toLowerCase(Locale.ROOT);
        String obligation = obligationType.toLowerCase(Locale.ROOT);

        for (List<List<String>> pair : RIGHTS_OBLIGATION_CONFLICT_PAIRS) {
            boolean rightMatch = pair.get(0).stream().anyMatch(right::contains);
            boolean obligationMatch = pair.get(1).stream().anyMatch(obligation::contains);
            if (rightMatch && obligationMatch) {
                return true;
            }
        }
        return false;
    }

    static List<String> extractRightKeywords(String text) {
        String normalized = normalizeLower(text);
        Set<String> keywords = new LinkedHashSet<>();
        for (Pattern pattern : RIGHT_KEYWORD_PATTERNS) {
            Matcher m = pattern.matcher(normalized);
            while (m.find()) {
                keywords.add(m.group(1).trim());
            }
        }
        return new ArrayList<>(keywords);
    }

    /**
     * Provisions that reference the parent of an obligation or right node, excluding the parent itself.
     */
    static List<String> findDependents(String nodeUri, TripleStore store) {
        List<Triple> parents = store.find(nodeUri, GraphVocabulary.PART_OF, null);
        if (parents.isEmpty()) {
            return List.of();
        }
        String parentUri = parents.get(0).getObject();
        Set<String> dependents = new LinkedHashSet<>();

        for (Triple t : store.find(null, GraphVocabulary.REFERENCES, parentUri)) {
            if (!t.getSubject().equals(parentUri)) {
                dependents.add(t.getSubject());
            }
        }
        for (Triple t : store.find(parentUri, GraphVocabulary.REFERENCED_BY, null)) {
            if (!t.getObject().equals(parentUri)) {
                dependents.add(t.getObject());
            }
        }
        return new ArrayList<>(dependents);
    }

    // ===== OBLIGATION CHECKS =====

    private List<Conflict> findContradictions(DiffEntry entry, TripleStore store) {
        List<Conflict> conflicts = new ArrayList<>();
        String proposedText = entry.effectiveProposedText();
        if (proposedText.isEmpty()) {
            return conflicts;
        }

        for (Triple t : store.find(entry.getTargetUri(), GraphVocabulary.IMPOSES_OBLIGATION, null)) {
            String obligationUri = t.getObject();
            String existingText = store.getOne(obligationUri, GraphVocabulary.TEXT);
            if (existingText.isEmpty() || !detectObligationContradiction(proposedText, existingText)) {
                continue;
            }
            conflicts.add(Conflict.builder()
                    .type(ConflictType.OBLIGATION_CONTRADICTION)
                    .severity(classifySeverity(ConflictType.OBLIGATION_CONTRADICTION))
                    .sourceAmendment(entry.getAmendment())
                    .existingProvision(obligationUri)
                    .existingText(existingText)
                    .proposedText(proposedText)
                    .description(String.format(
                            "proposed amendment contradicts existing obligation in %s: existing directive conflicts with proposed text",
                            ProvisionLabels.uriLabel(obligationUri)))
                    .build());
        }
        return conflicts;
    }

    private List<Conflict> findOrphanedObligations(DiffEntry entry, TripleStore store) {
        List<Conflict> conflicts = new ArrayList<>();
        for (Triple t : store.find(entry.getTargetUri(), GraphVocabulary.IMPOSES_OBLIGATION, null)) {
            String obligationUri = t.getObject();
            List<String> dependents = findDependents(obligationUri, store);
            if (dependents.isEmpty()) {
                continue;
            }
            conflicts.add(Conflict.builder()
                    .type(ConflictType.OBLIGATION_ORPHANED)
                    .severity(classifySeverity(ConflictType.OBLIGATION_ORPHANED))
                    .sourceAmendment(entry.getAmendment())
                    .existingProvision(obligationUri)
                    .existingText(store.getOne(obligationUri, GraphVocabulary.TEXT))
                    .description(String.format("repealing %s orphans obligation %s depended on by: %s",
                            ProvisionLabels.uriLabel(entry.getTargetUri()),
                            ProvisionLabels.uriLabel(obligationUri),
                            joinLabels(dependents)))
                    .build());
        }
        return conflicts;
    }

    private List<Conflict> findDuplicateObligations(DiffEntry entry, TripleStore store) {
        List<Conflict> conflicts = new ArrayList<>();
        String proposedText = entry.effectiveProposedText();
        if (proposedText.isEmpty()) {
            return conflicts;
        }
        List<Directive> proposed = DirectiveExtractor.extract(proposedText);
        if (proposed.isEmpty()) {
            return conflicts;
        }

        for (Triple t : store.find(null, GraphVocabulary.RDF_TYPE, GraphVocabulary.CLASS_OBLIGATION)) {
            String obligationUri = t.getSubject();
            String existingText = store.getOne(obligationUri, GraphVocabulary.TEXT);
            if (existingText.isEmpty()) {
                continue;
            }
            List<Directive> existing = DirectiveExtractor.extract(existingText);
            if (existing.isEmpty()
                    || !DirectiveExtractor.anyDuplicate(proposed, existing, config.getDuplicateKeywordThreshold())) {
                continue;
            }
            conflicts.add(Conflict.builder()
                    .type(ConflictType.OBLIGATION_DUPLICATE)
                    .severity(classifySeverity(ConflictType.OBLIGATION_DUPLICATE))
                    .sourceAmendment(entry.getAmendment())
                    .existingProvision(obligationUri)
                    .existingText(existingText)
                    .proposedText(proposedText)
                    .description(String.format("proposed obligation duplicates existing obligation in %s",
                            ProvisionLabels.uriLabel(parentOf(obligationUri, store))))
                    .build());
        }
        return conflicts;
    }

    // ===== RIGHTS CHECKS =====

    private List<Conflict> findRightsNarrowing(DiffEntry entry, TripleStore store) {
        List<Conflict> conflicts = new ArrayList<>();
        String proposedText = entry.effectiveProposedText();
        if (proposedText.isEmpty()) {
            return conflicts;
        }

        for (Triple t : store.find(entry.getTargetUri(), GraphVocabulary.GRANTS_RIGHT, null)) {
            String rightUri = t.getObject();
            String existingText = store.getOne(rightUri, GraphVocabulary.TEXT);
            if (existingText.isEmpty() || !detectRightsNarrowing(existingText, proposedText)) {
                continue;
            }
            conflicts.add(Conflict.builder()
                    .type(ConflictType.RIGHTS_NARROWING)
                    .severity(classifySeverity(ConflictType.RIGHTS_NARROWING))
                    .sourceAmendment(entry.getAmendment())
                    .existingProvision(rightUri)
                    .existingText(existingText)
                    .proposedText(proposedText)
                    .description(String.format(
                            "proposed amendment narrows existing right in %s: qualifying or limiting language detected",
                            ProvisionLabels.uriLabel(rightUri)))
                    .build());
        }
        return conflicts;
    }

    private List<Conflict> findRepealedRights(DiffEntry entry, TripleStore store) {
        List<Conflict> conflicts = new ArrayList<>();
        for (Triple t : store.find(entry.getTargetUri(), GraphVocabulary.GRANTS_RIGHT, null)) {
            String rightUri = t.getObject();
            List<String> dependents = findDependents(rightUri, store);
            if (dependents.isEmpty()) {
                continue;
            }
            conflicts.add(Conflict.builder()
                    .type(ConflictType.RIGHTS_NARROWING)
                    .severity(Severity.WARNING)
                    .sourceAmendment(entry.getAmendment())
                    .existingProvision(rightUri)
                    .existingText(store.getOne(rightUri, GraphVocabulary.TEXT))
                    .description(String.format("repealing %s removes right %s depended on by: %s",
                            ProvisionLabels.uriLabel(entry.getTargetUri()),
                            ProvisionLabels.uriLabel(rightUri),
                            joinLabels(dependents)))
                    .build());
        }
        return conflicts;
    }

    private List<Conflict> findRightsObligationConflicts(DiffEntry entry, TripleStore store) {
        List<Conflict> conflicts = new ArrayList<>();
        String proposedText = entry.effectiveProposedText();
        if (proposedText.isEmpty()) {
            return conflicts;
        }
        List<String> rightKeywords = extractRightKeywords(proposedText);
        if (rightKeywords.isEmpty()) {
            return conflicts;
        }
        List<Triple> obligations = store.find(null, GraphVocabulary.RDF_TYPE, GraphVocabulary.CLASS_OBLIGATION);

        for (String rightKeyword : rightKeywords) {
            for (Triple t : obligations) {
                String obligationUri = t.getSubject();
                String obligationText = store.getOne(obligationUri, GraphVocabulary.TEXT);
                if (obligationText.isEmpty()) {
                    continue;
                }
                String obligationType = store.getOne(obligationUri, GraphVocabulary.OBLIGATION_TYPE);
                if (!detectRightsObligationConflict(rightKeyword, obligationType)) {
                    continue;
                }
                conflicts.add(Conflict.builder()
                        .type(ConflictType.RIGHTS_CONTRADICTION)
                        .severity(classifySeverity(ConflictType.RIGHTS_CONTRADICTION))
                        .sourceAmendment(entry.getAmendment())
                        .existingProvision(obligationUri)
                        .existingText(obligationText)
                        .proposedText(proposedText)
                        .description(String.format("proposed right '%s' conflicts with existing obligation in %s",
                                rightKeyword, ProvisionLabels.uriLabel(parentOf(obligationUri, store))))
                        .build());
                // one report per right keyword
                break;
            }
        }
        return conflicts;
    }

    private List<Conflict> findRightsExpansion(DiffEntry entry, TripleStore store) {
        List<Conflict> conflicts = new ArrayList<>();
        String proposedText = entry.effectiveProposedText();
        if (proposedText.isEmpty()) {
            return conflicts;
        }
        List<String> rightKeywords = extractRightKeywords(proposedText);
        if (rightKeywords.isEmpty()) {
            return conflicts;
        }

        Set<String> knownRightTypes = new HashSet<>();
        for (Triple t : store.find(null, GraphVocabulary.RDF_TYPE, GraphVocabulary.CLASS_RIGHT)) {
            String rightType = store.getOne(t.getSubject(), GraphVocabulary.RIGHT_TYPE);
            if (!rightType.isEmpty()) {
                knownRightTypes.add(rightType.toLowerCase(Locale.ROOT));
            }
        }

        for (String rightKeyword : rightKeywords) {
            if (knownRightTypes.contains(rightKeyword.toLowerCase(Locale.ROOT))) {
                continue;
            }
            conflicts.add(Conflict.builder()
                    .type(ConflictType.RIGHTS_EXPANSION)
                    .severity(classifySeverity(ConflictType.RIGHTS_EXPANSION))
                    .sourceAmendment(entry.getAmendment())
                    .proposedText(proposedText)
                    .description("proposed legislation introduces new right: " + rightKeyword)
                    .build());
        }
        return conflicts;
    }

    // ===== HELPERS =====

    private static String parentOf(String nodeUri, TripleStore store) {
        String parent = store.getOne(nodeUri, GraphVocabulary.PART_OF);
        return parent.isEmpty() ? nodeUri : parent;
    }

    private static String joinLabels(List<String> uris) {
        List<String> labels = new ArrayList<>(uris.size());
        for (String uri : uris) {
            labels.add(ProvisionLabels.uriLabel(uri));
        }
        return String.join(", ", labels);
    }

    private static String normalizeLower(String text) {
        if (text == null) {
            return "";
        }
        return String.join(" ", text.trim().split("\\s+")).toLowerCase(Locale.ROOT);
    }

    private static void requireInputs(DraftDiff diff, DraftLibrary library) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        if (library == null) {
            throw new LibraryUnavailableException("library is null");
        }
    }
}
