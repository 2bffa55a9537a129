package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.draft.AmendmentType;
import com.lawgraph.draftimpact.dto.finding.Conflict;
import com.lawgraph.draftimpact.dto.finding.ConflictReport;
import com.lawgraph.draftimpact.dto.finding.ConflictType;
import com.lawgraph.draftimpact.dto.finding.Severity;
import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.InMemoryTripleStore;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.InMemoryLibraryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.lawgraph.draftimpact.GraphFixtures.addArticle;
import static com.lawgraph.draftimpact.GraphFixtures.addObligation;
import static com.lawgraph.draftimpact.GraphFixtures.addReference;
import static com.lawgraph.draftimpact.GraphFixtures.addRight;
import static com.lawgraph.draftimpact.GraphFixtures.article;
import static com.lawgraph.draftimpact.GraphFixtures.entry;
import static com.lawgraph.draftimpact.GraphFixtures.library;
import static com.lawgraph.draftimpact.GraphFixtures.obligation;
import static com.lawgraph.draftimpact.GraphFixtures.right;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConflictDetectionServiceTest {

    private DraftAnalysisConfig config;
    private ConflictDetectionService conflictDetectionService;
    private InMemoryTripleStore store;

    @BeforeEach
    void setUp() {
        config = DraftAnalysisConfig.defaults();
        conflictDetectionService = new ConflictDetectionService(new InMemoryLibraryRegistry(), config);

        store = new InMemoryTripleStore();
        for (String section : new String[] {"6501", "6502", "6503", "6504"}) {
            addArticle(store, section, "Section " + section);
        }
        addObligation(store, "6502", "TransparencyObligation", "The operator shall provide notice to consumers.");
        addReference(store, "6503", "6502");
    }

    // ===== OBLIGATIONS =====

    @Test
    void detectConflicts_whenAmendmentNegatesExistingObligation() {
        DraftDiff diff = DraftDiff.builder()
                .modified(List.of(entry(AmendmentType.STRIKE_INSERT, "6502",
                        "The operator shall not provide notice to consumers.")))
                .build();

        ConflictReport report = conflictDetectionService.detectConflicts(diff, library(store));

        assertThat(report.getConflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.getType()).isEqualTo(ConflictType.OBLIGATION_CONTRADICTION);
            assertThat(conflict.getSeverity()).isEqualTo(Severity.ERROR);
            assertThat(conflict.getExistingProvision()).isEqualTo(obligation("6502", "TransparencyObligation"));
            assertThat(conflict.getDescription()).startsWith(
                    "proposed amendment contradicts existing obligation in TransparencyObligation");
        });
        assertThat(report.getSummary().getErrors()).isEqualTo(1);
        assertThat(report.getSummary().getTotalConflicts()).isEqualTo(1);
    }

    @Test
    void detectConflicts_whenAmendmentRestatesObligation() {
        DraftDiff diff = DraftDiff.builder()
                .modified(List.of(entry(AmendmentType.STRIKE_INSERT, "6502",
                        "The operator shall provide written notice to consumers.")))
                .build();

        assertThat(conflictDetectionService.detectConflicts(diff, library(store)).getConflicts()).isEmpty();
    }

    @Test
    void detectConflicts_whenRepealOrphansReferencedObligation() {
        DraftDiff diff = DraftDiff.builder()
                .removed(List.of(entry(AmendmentType.REPEAL, "6502", "")))
                .build();

        List<Conflict> conflicts = conflictDetectionService.detectConflicts(diff, library(store)).getConflicts();

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.getType()).isEqualTo(ConflictType.OBLIGATION_ORPHANED);
            assertThat(conflict.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(conflict.getDescription()).isEqualTo(
                    "repealing Art6502 orphans obligation TransparencyObligation depended on by: Art6503");
        });
    }

    @Test
    void detectConflicts_whenAddedSectionDuplicatesObligation() {
        DraftDiff diff = DraftDiff.builder()
                .added(List.of(entry(AmendmentType.ADD_NEW_SECTION, "6505",
                        "Each operator shall provide notice to consumers promptly.")))
                .build();

        List<Conflict> conflicts = conflictDetectionService.detectConflicts(diff, library(store)).getConflicts();

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.getType()).isEqualTo(ConflictType.OBLIGATION_DUPLICATE);
            assertThat(conflict.getSeverity()).isEqualTo(Severity.INFO);
            assertThat(conflict.getDescription()).isEqualTo("proposed obligation duplicates existing obligation in Art6502");
        });
    }

    @Test
    void detectConflicts_whenDuplicateThresholdIsNotReached() {
        config.setDuplicateKeywordThreshold(5);
        DraftDiff diff = DraftDiff.builder()
                .added(List.of(entry(AmendmentType.ADD_NEW_SECTION, "6505",
                        "Each operator shall provide notice to consumers promptly.")))
                .build();

        assertThat(conflictDetectionService.detectConflicts(diff, library(store)).getConflicts()).isEmpty();
    }

    // ===== RIGHTS =====

    @Test
    void detectConflicts_whenAmendmentQualifiesExistingRight() {
        addRight(store, "6504", "RightOfAccess", "A consumer has the right to access personal information.");
        DraftDiff diff = DraftDiff.builder()
                .modified(List.of(entry(AmendmentType.STRIKE_INSERT, "6504",
                        "A consumer has the right to access personal information except when disclosure is unlawful.")))
                .build();

        List<Conflict> conflicts = conflictDetectionService.detectConflicts(diff, library(store)).getConflicts();

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.getType()).isEqualTo(ConflictType.RIGHTS_NARROWING);
            assertThat(conflict.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(conflict.getExistingProvision()).isEqualTo(right("6504", "RightOfAccess"));
        });
    }

    @Test
    void detectConflicts_whenRepealRemovesReferencedRight() {
        addRight(store, "6503", "RightOfAccess", "A consumer has the right to access records.");
        addReference(store, "6504", "6503");
        DraftDiff diff = DraftDiff.builder()
                .removed(List.of(entry(AmendmentType.REPEAL, "6503", "")))
                .build();

        List<Conflict> conflicts = conflictDetectionService.detectConflicts(diff, library(store)).getConflicts();

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.getType()).isEqualTo(ConflictType.RIGHTS_NARROWING);
            assertThat(conflict.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(conflict.getDescription()).isEqualTo(
                    "repealing Art6503 removes right RightOfAccess depended on by: Art6504");
        });
    }

    @Test
    void detectConflicts_whenNewRightClashesWithObligation() {
        addObligation(store, "6501", "NondisclosureObligation", "The agency shall keep records confidential.");
        addObligation(store, "6504", "ConfidentialityNondisclosureObligation", "Staff shall not reveal records.");
        DraftDiff diff = DraftDiff.builder()
                .added(List.of(entry(AmendmentType.ADD_NEW_SECTION, "6505",
                        "Consumers have the right to access their records.")))
                .build();

        List<Conflict> conflicts = conflictDetectionService.detectConflicts(diff, library(store)).getConflicts();

        // one contradiction per right keyword, however many obligations clash
        assertThat(conflicts).extracting(Conflict::getType)
                .containsExactly(ConflictType.RIGHTS_CONTRADICTION, ConflictType.RIGHTS_EXPANSION);
        assertThat(conflicts.get(0).getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(conflicts.get(0).getDescription()).startsWith("proposed right 'access their' conflicts with existing obligation in Art");
        assertThat(conflicts.get(1).getSeverity()).isEqualTo(Severity.INFO);
        assertThat(conflicts.get(1).getDescription()).isEqualTo("proposed legislation introduces new right: access their");
    }

    @Test
    void detectConflicts_whenNewRightIsAlreadyKnown() {
        addRight(store, "6501", "portability", "A consumer is entitled to portability.");
        DraftDiff diff = DraftDiff.builder()
                .added(List.of(entry(AmendmentType.ADD_NEW_SECTION, "6505", "Consumers are entitled to portability.")))
                .build();

        assertThat(conflictDetectionService.detectConflicts(diff, library(store)).getConflicts()).isEmpty();
    }

    @Test
    void detectConflicts_whenLibraryIsMissing() {
        assertThatThrownBy(() -> conflictDetectionService.detectConflicts(new DraftDiff(), (DraftLibrary) null))
                .isInstanceOf(LibraryUnavailableException.class);
        assertThatThrownBy(() -> conflictDetectionService.detectConflicts(null, library(store)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ===== CLASSIFIERS =====

    @Test
    void classifySeverity_mapsEveryConflictType() {
        assertThat(ConflictDetectionService.classifySeverity(ConflictType.OBLIGATION_CONTRADICTION)).isEqualTo(Severity.ERROR);
        assertThat(ConflictDetectionService.classifySeverity(ConflictType.RIGHTS_CONTRADICTION)).isEqualTo(Severity.ERROR);
        assertThat(ConflictDetectionService.classifySeverity(ConflictType.OBLIGATION_ORPHANED)).isEqualTo(Severity.WARNING);
        assertThat(ConflictDetectionService.classifySeverity(ConflictType.RIGHTS_NARROWING)).isEqualTo(Severity.WARNING);
        assertThat(ConflictDetectionService.classifySeverity(ConflictType.OBLIGATION_DUPLICATE)).isEqualTo(Severity.INFO);
        assertThat(ConflictDetectionService.classifySeverity(ConflictType.RIGHTS_EXPANSION)).isEqualTo(Severity.INFO);
        assertThat(ConflictDetectionService.classifySeverity(null)).isEqualTo(Severity.WARNING);
    }

    @Test
    void detectObligationContradiction_whenKeywordsAreDisjoint() {
        assertThat(ConflictDetectionService.detectObligationContradiction(
                "The agency shall disclose annual reports.", "The agency shall not retain logs.")).isFalse();
        assertThat(ConflictDetectionService.detectObligationContradiction(
                "The agency shall not disclose reports.", "The agency shall disclose reports.")).isTrue();
    }

    @Test
    void detectObligationContradiction_whenBothTextsAreNegated() {
        assertThat(ConflictDetectionService.detectObligationContradiction(
                "The agency shall not disclose reports.", "The agency shall not disclose reports.")).isFalse();
        assertThat(ConflictDetectionService.detectObligationContradiction(
                "The agency must not disclose reports.", "The agency must not disclose reports.")).isFalse();
    }

    @Test
    void detectRightsNarrowing_whenQualifierIsAddedOrGrantIsDropped() {
        String existing = "A consumer has the right to access personal information";

        assertThat(ConflictDetectionService.detectRightsNarrowing(existing,
                existing + " except when disclosure is unlawful")).isTrue();
        assertThat(ConflictDetectionService.detectRightsNarrowing(existing,
                existing + " and correct it")).isFalse();
        assertThat(ConflictDetectionService.detectRightsNarrowing(
                "A consumer is entitled to a copy", "A consumer may receive a copy")).isTrue();
        assertThat(ConflictDetectionService.detectRightsNarrowing(
                "Subject to subsection (b), a consumer may request deletion",
                "Subject to subsection (b), a consumer may request deletion")).isFalse();
    }

    @Test
    void detectRightsObligationConflict_matchesOpposingTerms() {
        assertThat(ConflictDetectionService.detectRightsObligationConflict("erasure", "DataRetentionObligation")).isTrue();
        assertThat(ConflictDetectionService.detectRightsObligationConflict("portability", "DataLocalizationObligation")).isTrue();
        assertThat(ConflictDetectionService.detectRightsObligationConflict("access", "SecurityObligation")).isFalse();
    }

    @Test
    void extractRightKeywords_collectsDistinctPhrases() {
        assertThat(ConflictDetectionService.extractRightKeywords(
                "A consumer has the right to erasure. The consumer may object, and may object again."))
                .containsExactly("erasure", "object");
    }

    @Test
    void findDependents_excludesParentItself() {
        addReference(store, "6502", "6502");
        store.add(article("6502"), GraphVocabulary.REFERENCED_BY, article("6504"));

        assertThat(ConflictDetectionService.findDependents(obligation("6502", "TransparencyObligation"), store))
                .containsExactly(article("6503"), article("6504"));
    }
}
