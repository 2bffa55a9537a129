package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.finding.EffectiveDateInfo;
import com.lawgraph.draftimpact.dto.finding.Severity;
import com.lawgraph.draftimpact.dto.finding.TemporalFinding;
import com.lawgraph.draftimpact.dto.finding.TemporalIssueType;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.Triple;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.DraftLibraryOpener;
import com.lawgraph.draftimpact.service.graph.ProvisionLabels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks a bill for temporal problems: repeals that leave a gap, modifications that clash with
 * the temporal status of provisions referencing them, retroactive application and sunset clauses.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TemporalConsistencyAnalyzer {

    private static final int QUOTE_MAX_LENGTH = 100;

    private static final Pattern SECTION_IN_URI = Pattern.compile(":Art(\\d+)");

    private static final List<Pattern> RETROACTIVE_PATTERNS = List.of(
            Pattern.compile("(?i)shall\\s+apply\\s+to\\s+(?:any\\s+)?(?:action|conduct|violation|proceeding)s?\\s+(?:taken|occurring|commenced)\\s+(?:before|prior\\s+to)\\s+(?:the\\s+)?date\\s+of\\s+(?:the\\s+)?enactment"),
            Pattern.compile("(?i)retroactive(?:ly)?\\s+(?:to|effective)"),
            Pattern.compile("(?i)applies?\\s+(?:retroactively|to\\s+past\\s+(?:conduct|actions|events))"),
            Pattern.compile("(?i)(?:effective|apply)\\s+(?:as\\s+of|beginning)\\s+(?:a\\s+date\\s+)?(?:before|prior\\s+to)\\s+(?:the\\s+)?(?:date\\s+of\\s+)?enactment")
    );

    private static final List<Pattern> SUNSET_PATTERNS = List.of(
            Pattern.compile("(?i)(?:this\\s+)?(?:section|act|provision)\\s+(?:shall\\s+)?(?:expire|terminate)"),
            Pattern.compile("(?i)cease\\s+to\\s+(?:be\\s+)?(?:effective|in\\s+effect)"),
            Pattern.compile("(?i)sunset\\s+(?:date|provision|clause)"),
            Pattern.compile("(?i)shall\\s+(?:not\\s+)?(?:remain\\s+)?in\\s+effect\\s+(?:only\\s+)?(?:until|through|for\\s+a\\s+period\\s+of)"),
            Pattern.compile("(?i)(?:is\\s+)?repealed\\s+(?:effective|on)\\s+(january|february|march|april|may|june|july|august|september|october|november|december)\\s+\\d{1,2},?\\s+\\d{4}")
    );

    private final DraftLibraryOpener libraryOpener;
    private final EffectiveDateParser effectiveDateParser;
    private final DraftAnalysisConfig config;

    /**
     * Analyze with a library path. A blank path skips the graph-backed contradiction check,
     * as does a path that cannot be opened.
     */
    public List<TemporalFinding> analyze(DraftDiff diff, String libraryPath) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        DraftLibrary library = null;
        if (libraryPath != null && !libraryPath.isBlank()) {
            try {
                library = libraryOpener.open(libraryPath);
            } catch (RuntimeException e) {
                log.warn("Temporal contradiction check skipped, library {} unavailable: {}",
                        libraryPath, e.getMessage());
            }
        }
        return analyze(diff, library);
    }

    /**
     * @param library may be {@code null}; contradictions are then not checked
     */
    public List<TemporalFinding> analyze(DraftDiff diff, DraftLibrary library) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        String rawText = diff.getBill() == null ? "" : diff.getBill().getRawText();
        Optional<EffectiveDateInfo> effectiveDate = effectiveDateParser.parse(rawText);
        log.debug("Effective date: {}", effectiveDate.map(EffectiveDateInfo::getRawText).orElse("none"));

        List<TemporalFinding> findings = new ArrayList<>();
        findings.addAll(detectGaps(diff.getRemoved(), diff.getAdded(), effectiveDate.orElse(null)));
        findings.addAll(detectRetroactiveApplication(rawText));
        if (library != null) {
            findings.addAll(detectContradictions(diff.getModified(), library));
        }
        findings.addAll(detectSunsetClauses(rawText));

        log.info("Temporal analysis complete: {} findings", findings.size());
        findings.forEach(f -> log.debug("[{}] {}: {}", f.severityLabel(), f.typeLabel(), f.getDescription()));
        return findings;
    }

    // ===== GAPS =====

    public List<TemporalFinding> detectGaps(List<DiffEntry> repeals, List<DiffEntry> additions,
                                            EffectiveDateInfo effectiveDate) {
        List<TemporalFinding> findings = new ArrayList<>();
        if (repeals.isEmpty()) {
            return findings;
        }

        Map<String, DiffEntry> addedSections = new LinkedHashMap<>();
        for (DiffEntry addition : additions) {
            String section = sectionOf(addition.getTargetUri());
            if (!section.isEmpty()) {
                addedSections.put(section, addition);
            }
        }

        for (DiffEntry repeal : repeals) {
            String repealedSection = sectionOf(repeal.getTargetUri());
            if (repealedSection.isEmpty()) {
                continue;
            }

            DiffEntry replacement = null;
            for (Map.Entry<String, DiffEntry> added : addedSections.entrySet()) {
                if (isRelatedSection(repealedSection, added.getKey())) {
                    replacement = added.getValue();
                    break;
                }
            }

            if (replacement == null) {
                findings.add(TemporalFinding.builder()
                        .type(TemporalIssueType.GAP)
                        .severity(Severity.WARNING)
                        .description(String.format("section %s is repealed with no apparent replacement in this bill",
                                repealedSection))
                        .provision(repeal.getTargetUri())
                        .build());
            } else if (effectiveDate == null) {
                findings.add(TemporalFinding.builder()
                        .type(TemporalIssueType.GAP)
                        .severity(Severity.WARNING)
                        .description(String.format(
                                "potential temporal gap: section %s is repealed and section %s is added, but effective dates could not be determined",
                                repealedSection, sectionOf(replacement.getTargetUri())))
                        .provision(repeal.getTargetUri())
                        .provision(replacement.getTargetUri())
                        .build());
            }
        }
        return findings;
    }

    /**
     * Same number, a suffix-extended number (6502 and 6502A), or the same block of ten
     * (6502 and 6503). The last two are configurable.
     */
    public boolean isRelatedSection(String original, String candidate) {
        if (original == null || candidate == null || original.isEmpty() || candidate.isEmpty()) {
            return false;
        }
        if (original.equals(candidate)) {
            return true;
        }
        if (config.isRelatedSectionPrefixMatch() && candidate.startsWith(original)) {
            return true;
        }
        if (config.isRelatedSectionBlockMatch() && original.length() >= 3 && candidate.length() >= 3) {
            return original.substring(0, original.length() - 1)
                    .equals(candidate.substring(0, candidate.length() - 1));
        }
        return false;
    }

    static String sectionOf(String uri) {
        if (uri == null) {
            return "";
        }
        Matcher m = SECTION_IN_URI.matcher(uri);
        return m.find() ? m.group(1) : "";
    }

    // ===== CONTRADICTIONS =====

    private List<TemporalFinding> detectContradictions(List<DiffEntry> modifications, DraftLibrary library) {
        List<TemporalFinding> findings = new ArrayList<>();
        if (modifications.isEmpty()) {
            return findings;
        }
        GraphSnapshotCache snapshots = new GraphSnapshotCache(library);

        for (DiffEntry modification : modifications) {
            Optional<TripleStore> loaded = snapshots.tryLoad(modification.getTargetDocumentId());
            if (loaded.isEmpty()) {
                continue;
            }
            TripleStore store = loaded.get();

            for (Triple t : store.find(modification.getTargetUri(), GraphVocabulary.TEMPORAL_KIND, null)) {
                String temporalKind = t.getObject();
                String kind = temporalKind.toLowerCase(Locale.ROOT);
                if (!kind.contains("in_force") && !kind.contains("as_amended")) {
                    continue;
                }
                List<String> related = findCurrentReferencingProvisions(modification.getTargetUri(), store);
                if (related.isEmpty()) {
                    continue;
                }
                findings.add(TemporalFinding.builder()
                        .type(TemporalIssueType.CONTRADICTION)
                        .severity(Severity.ERROR)
                        .description(String.format(
                                "potential temporal contradiction: modifying %s which has temporal status '%s' while related provisions may be in conflicting temporal states",
                                ProvisionLabels.uriLabel(modification.getTargetUri()), temporalKind))
                        .provision(modification.getTargetUri())
                        .provisions(related)
                        .build());
            }
        }
        return findings;
    }

    private static List<String> findCurrentReferencingProvisions(String targetUri, TripleStore store) {
        List<String> current = new ArrayList<>();
        for (Triple ref : store.find(null, GraphVocabulary.REFERENCES, targetUri)) {
            String relatedUri = ref.getSubject();
            for (Triple status : store.find(relatedUri, GraphVocabulary.TEMPORAL_KIND, null)) {
                String kind = status.getObject().toLowerCase(Locale.ROOT);
                if (kind.contains("in_force") || kind.contains("current")) {
                    current.add(relatedUri);
                    break;
                }
            }
        }
        return current;
    }

    // ===== TEXT SCANS =====

    public List<TemporalFinding> detectRetroactiveApplication(String billText) {
        return scan(billText, RETROACTIVE_PATTERNS, TemporalIssueType.RETROACTIVE, Severity.WARNING,
                "retroactive application detected: '%s'");
    }

    public List<TemporalFinding> detectSunsetClauses(String billText) {
        return scan(billText, SUNSET_PATTERNS, TemporalIssueType.SUNSET, Severity.INFO,
                "sunset clause detected: '%s'");
    }

    private static List<TemporalFinding> scan(String billText, List<Pattern> patterns, TemporalIssueType type,
                                              Severity severity, String template) {
        List<TemporalFinding> findings = new ArrayList<>();
        String text = EffectiveDateParser.normalizeLower(billText);
        if (text.isEmpty()) {
            return findings;
        }
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                findings.add(TemporalFinding.builder()
                        .type(type)
                        .severity(severity)
                        .description(String.format(template, quote(m.group())))
                        .build());
            }
        }
        return findings;
    }

    private static String quote(String text) {
        if (text.length() <= QUOTE_MAX_LENGTH) {
            return text;
        }
        return text.substring(0, QUOTE_MAX_LENGTH - 3) + "...";
    }
}
