package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.config.DraftAnalysisConfig;
import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import com.lawgraph.draftimpact.dto.draft.AmendmentType;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import com.lawgraph.draftimpact.dto.draft.DraftSection;
import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.InMemoryTripleStore;
import com.lawgraph.draftimpact.repository.DocumentEntry;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.InMemoryLibraryRegistry;
import com.lawgraph.draftimpact.service.graph.ProvisionUriBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.lawgraph.draftimpact.GraphFixtures.BASE;
import static com.lawgraph.draftimpact.GraphFixtures.DOC;
import static com.lawgraph.draftimpact.GraphFixtures.addArticle;
import static com.lawgraph.draftimpact.GraphFixtures.addReference;
import static com.lawgraph.draftimpact.GraphFixtures.amendment;
import static com.lawgraph.draftimpact.GraphFixtures.article;
import static com.lawgraph.draftimpact.GraphFixtures.library;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DraftDiffServiceTest {

    @Mock
    private DraftLibrary failingLibrary;

    private InMemoryLibraryRegistry registry;
    private DraftDiffService diffService;
    private InMemoryTripleStore store;

    @BeforeEach
    void setUp() {
        registry = new InMemoryLibraryRegistry();
        diffService = new DraftDiffService(registry, new ProvisionUriBuilder(DraftAnalysisConfig.defaults()));

        store = new InMemoryTripleStore();
        addArticle(store, "6501", "Definitions.");
        addArticle(store, "6502", "It is unlawful for an operator to collect personal information from a child.");
        addArticle(store, "6503", "Safe harbors.");
        addReference(store, "6503", "6502");
        store.add(article("6502"), GraphVocabulary.REFERENCED_BY, article("6503"));
        store.add(article("6502"), GraphVocabulary.REFERENCED_BY, article("6501"));
        addReference(store, "6502", "6501");
    }

    @Test
    void computeDiff_classifiesEachAmendmentIntoOneBucket() {
        DraftBill bill = bill(
                amendment(AmendmentType.STRIKE_INSERT, "6502", "16 years"),
                amendment(AmendmentType.REPEAL, "6503", ""),
                amendment(AmendmentType.ADD_AT_END, "6504", "(e) New requirements."),
                amendment(AmendmentType.REDESIGNATE, "6501", "(d)"),
                amendment(AmendmentType.TABLE_OF_CONTENTS, "6501", ""));

        DraftDiff diff = diffService.computeDiff(bill, library(store));

        assertThat(diff.getModified()).extracting(DiffEntry::getTargetUri)
                .containsExactly(article("6502"), article("6501"));
        assertThat(diff.getRemoved()).extracting(DiffEntry::getTargetUri).containsExactly(article("6503"));
        assertThat(diff.getAdded()).extracting(DiffEntry::getTargetUri).containsExactly(article("6504"));
        assertThat(diff.getRedesignated()).extracting(DiffEntry::getTargetUri).containsExactly(article("6501"));
        assertThat(diff.getSummary().getTotalAmendments()).isEqualTo(5);
    }

    @Test
    void computeDiff_capturesTextAndDeduplicatedCrossReferences() {
        DraftDiff diff = diffService.computeDiff(
                bill(amendment(AmendmentType.STRIKE_INSERT, "6502", "16 years")), library(store));

        DiffEntry entry = diff.getModified().get(0);
        assertThat(entry.getExistingText()).startsWith("It is unlawful");
        assertThat(entry.getProposedText()).isEqualTo("16 years");
        assertThat(entry.getTargetDocumentId()).isEqualTo(DOC);
        // 6503 appears through both the forward and the inverse edge
        assertThat(entry.getCrossRefsTo()).containsExactly(article("6503"), article("6501"));
        assertThat(entry.getCrossRefsFrom()).containsExactly(article("6501"));
    }

    @Test
    void computeDiff_countsSelfReferenceFromBothEnds() {
        InMemoryTripleStore selfReferencing = new InMemoryTripleStore();
        selfReferencing.add(article("6502"), GraphVocabulary.TEXT, "text");
        selfReferencing.add(article("6502"), GraphVocabulary.REFERENCES, article("6502"));

        DraftDiff diff = diffService.computeDiff(
                bill(amendment(AmendmentType.REPEAL, "6502", "")), library(selfReferencing));

        assertThat(diff.getRemoved().get(0).getAffectedTriples()).isEqualTo(3);
        assertThat(diff.getTriplesInvalidated()).isEqualTo(3);
    }

    @Test
    void computeDiff_recordsUnknownTitlesAsUnresolved() {
        Amendment unknownTitle = amendment(AmendmentType.STRIKE_INSERT, "1001", "x").toBuilder()
                .targetTitle("99")
                .targetSubsection("(b)")
                .build();
        Amendment noSection = amendment(AmendmentType.REPEAL, "", "");

        DraftDiff diff = diffService.computeDiff(bill(unknownTitle, noSection), library(store));

        assertThat(diff.getUnresolvedTargets()).containsExactly("99 U.S.C. 1001(b)", "15 U.S.C. ");
        assertThat(diff.allEntries()).isEmpty();
        assertThat(diff.getSummary().getUnresolved()).isEqualTo(2);
    }

    @Test
    void computeDiff_recordsUnloadableDocumentsAsUnresolved() {
        when(failingLibrary.getBaseUri()).thenReturn(BASE);
        when(failingLibrary.getDocument(DOC))
                .thenReturn(Optional.of(DocumentEntry.builder().documentId(DOC).build()));
        when(failingLibrary.loadGraph(DOC)).thenThrow(new LibraryUnavailableException("corrupt graph file"));

        DraftDiff diff = diffService.computeDiff(
                bill(amendment(AmendmentType.STRIKE_INSERT, "6502", "x")), failingLibrary);

        assertThat(diff.getUnresolvedTargets()).containsExactly("15 U.S.C. 6502");
        assertThat(diff.getModified()).isEmpty();
    }

    @Test
    void computeDiff_isDeterministic() {
        DraftBill bill = bill(
                amendment(AmendmentType.STRIKE_INSERT, "6502", "16 years"),
                amendment(AmendmentType.REPEAL, "6503", ""));

        DraftDiff first = diffService.computeDiff(bill, library(store));
        DraftDiff second = diffService.computeDiff(bill, library(store));

        assertThat(second.getModified()).isEqualTo(first.getModified());
        assertThat(second.getRemoved()).isEqualTo(first.getRemoved());
        assertThat(second.getTriplesInvalidated()).isEqualTo(first.getTriplesInvalidated());
    }

    @Test
    void computeDiff_opensLibraryByPath() {
        registry.register("/libraries/usc", library(store));

        DraftDiff diff = diffService.computeDiff(
                bill(amendment(AmendmentType.REPEAL, "6503", "")), "/libraries/usc");

        assertThat(diff.getRemoved()).hasSize(1);
    }

    @Test
    void computeDiff_rejectsMissingBillAndLibrary() {
        assertThatThrownBy(() -> diffService.computeDiff(null, library(store)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> diffService.computeDiff(bill(), "/nowhere"))
                .isInstanceOf(LibraryUnavailableException.class);
    }

    private static DraftBill bill(Amendment... amendments) {
        return DraftBill.builder()
                .billNumber("H.R. 1234")
                .title("Test Act")
                .sections(List.of(DraftSection.builder()
                        .number("2")
                        .amendments(List.of(amendments))
                        .build()))
                .build();
    }
}
