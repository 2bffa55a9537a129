package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import com.lawgraph.draftimpact.dto.overlay.OverlayStats;
import com.lawgraph.draftimpact.dto.overlay.ScenarioOverlay;
import com.lawgraph.draftimpact.dto.overlay.SkippedAmendment;
import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.InMemoryTripleStore;
import com.lawgraph.draftimpact.model.graph.Triple;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.DraftLibraryOpener;
import com.lawgraph.draftimpact.service.extract.ExtractedReference;
import com.lawgraph.draftimpact.service.extract.ReferenceExtractor;
import com.lawgraph.draftimpact.service.extract.ReferenceKind;
import com.lawgraph.draftimpact.service.extract.SemanticAnnotation;
import com.lawgraph.draftimpact.service.extract.SemanticExtractor;
import com.lawgraph.draftimpact.service.graph.ProvisionUriBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a diff to copies of the affected document graphs, producing a "proposed law" view.
 * The library's own graphs are never modified.
 *
 * Changes are applied in a fixed order: repeals, modifications, additions, redesignations.
 * Each modification, addition or redesignation works on a scratch copy that replaces the
 * document's graph only once the change has been applied in full.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScenarioOverlayService {

    private final DraftLibraryOpener libraryOpener;
    private final ProvisionUriBuilder uriBuilder;
    private final ReferenceExtractor referenceExtractor;
    private final SemanticExtractor semanticExtractor;

    public ScenarioOverlay applyOverlay(DraftDiff diff, String libraryPath) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        return applyOverlay(diff, libraryOpener.open(libraryPath));
    }

    public ScenarioOverlay applyOverlay(DraftDiff diff, DraftLibrary library) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        if (library == null) {
            throw new LibraryUnavailableException("library is null");
        }

        ScenarioOverlay overlay = ScenarioOverlay.builder().build();
        OverlayStats stats = overlay.getStats();
        String baseUri = uriBuilder.normalizeBaseUri(library.getBaseUri());
        Map<String, TripleStore> clones = new LinkedHashMap<>();

        for (DiffEntry entry : diff.getRemoved()) {
            TripleStore clone = cloneFor(entry, library, clones, overlay);
            if (clone != null) {
                stats.setTriplesRemoved(stats.getTriplesRemoved() + applyRepeal(entry.getTargetUri(), clone));
                overlay.getAppliedAmendments().add(entry.getAmendment());
            }
        }

        for (DiffEntry entry : diff.getModified()) {
            TripleStore clone = cloneFor(entry, library, clones, overlay);
            if (clone == null) {
                continue;
            }
            TripleStore scratch = cloneStore(clone);
            try {
                int removed = applyRepeal(entry.getTargetUri(), scratch);
                int added = ingestSection(entry.getAmendment(), scratch, baseUri, entry.getTargetDocumentId());
                clones.put(entry.getTargetDocumentId(), scratch);
                stats.setTriplesRemoved(stats.getTriplesRemoved() + removed);
                stats.setTriplesAdded(stats.getTriplesAdded() + added);
                overlay.getAppliedAmendments().add(entry.getAmendment());
            } catch (IllegalArgumentException e) {
                skip(overlay, entry.getAmendment(), "failed to apply modification, document left unchanged: "
                        + e.getMessage());
            }
        }

        for (DiffEntry entry : diff.getAdded()) {
            TripleStore clone = cloneFor(entry, library, clones, overlay);
            if (clone == null) {
                continue;
            }
            TripleStore scratch = cloneStore(clone);
            try {
                int added = ingestSection(entry.getAmendment(), scratch, baseUri, entry.getTargetDocumentId());
                clones.put(entry.getTargetDocumentId(), scratch);
                stats.setTriplesAdded(stats.getTriplesAdded() + added);
                overlay.getAppliedAmendments().add(entry.getAmendment());
            } catch (IllegalArgumentException e) {
                skip(overlay, entry.getAmendment(), "failed to apply addition, document left unchanged: "
                        + e.getMessage());
            }
        }

        for (DiffEntry entry : diff.getRedesignated()) {
            TripleStore clone = cloneFor(entry, library, clones, overlay);
            if (clone == null) {
                continue;
            }
            TripleStore scratch = cloneStore(clone);
            try {
                int added = applyRedesignation(entry, scratch);
                clones.put(entry.getTargetDocumentId(), scratch);
                stats.setTriplesAdded(stats.getTriplesAdded() + added);
                overlay.getAppliedAmendments().add(entry.getAmendment());
            } catch (IllegalArgumentException e) {
                skip(overlay, entry.getAmendment(), "failed to apply redesignation, document left unchanged: "
                        + e.getMessage());
            }
        }

        TripleStore merged = new InMemoryTripleStore();
        clones.values().forEach(merged::mergeFrom);
        overlay.setOverlayStore(merged);
        stats.setOverlayTriples(merged.count());

        log.info("Overlay built: {} applied, {} skipped, {} triples removed, {} added ({} -> {})",
                overlay.getAppliedAmendments().size(), overlay.getSkippedAmendments().size(),
                stats.getTriplesRemoved(), stats.getTriplesAdded(), stats.getBaseTriples(), stats.getOverlayTriples());
        return overlay;
    }

    /**
     * Independent copy of a snapshot; mutating it leaves the source untouched.
     */
    public TripleStore cloneStore(TripleStore source) {
        return source == null ? null : InMemoryTripleStore.copyOf(source);
    }

    /**
     * Translate a provision's proposed text into graph facts: identity and hierarchy facts,
     * internal references from the reference extractor, and rights and obligations from the
     * semantic extractor.
     *
     * @return net number of facts added
     */
    public int ingestSection(Amendment amendment, TripleStore store, String baseUri, String documentId) {
        String text = amendment.getInsertText();
        if (text == null || text.isEmpty()) {
            return 0;
        }

        int initialCount = store.count();
        String section = amendment.getTargetSection();
        String articleUri = uriBuilder.provisionUri(baseUri, documentId, section, amendment.getTargetSubsection());
        String regulationUri = uriBuilder.regulationUri(baseUri, documentId);

        store.add(articleUri, GraphVocabulary.RDF_TYPE, GraphVocabulary.CLASS_ARTICLE);
        store.add(articleUri, GraphVocabulary.NUMBER, section);
        store.add(articleUri, GraphVocabulary.TEXT, text);

        store.add(articleUri, GraphVocabulary.PART_OF, regulationUri);
        store.add(articleUri, GraphVocabulary.BELONGS_TO, regulationUri);
        store.add(regulationUri, GraphVocabulary.CONTAINS, articleUri);
        store.add(regulationUri, GraphVocabulary.HAS_ARTICLE, articleUri);

        for (ExtractedReference reference : referenceExtractor.extract(text)) {
            if (reference.getKind() != ReferenceKind.INTERNAL || reference.getArticleNumber() <= 0) {
                continue;
            }
            String referencedUri = uriBuilder.articleUri(baseUri, documentId, reference.getArticleNumber());
            store.add(articleUri, GraphVocabulary.REFERENCES, referencedUri);
            store.add(referencedUri, GraphVocabulary.REFERENCED_BY, articleUri);
        }

        for (SemanticAnnotation annotation : semanticExtractor.extract(text)) {
            switch (annotation.getKind()) {
                case RIGHT -> {
                    String rightUri = uriBuilder.rightUri(baseUri, documentId, section, annotation.getRightType());
                    store.add(rightUri, GraphVocabulary.RDF_TYPE, GraphVocabulary.CLASS_RIGHT);
                    store.add(rightUri, GraphVocabulary.RIGHT_TYPE, annotation.getRightType());
                    store.add(rightUri, GraphVocabulary.TEXT, annotation.getMatchedText());
                    store.add(rightUri, GraphVocabulary.PART_OF, articleUri);
                    store.add(articleUri, GraphVocabulary.GRANTS_RIGHT, rightUri);
                }
                case OBLIGATION, PROHIBITION -> {
                    String obligationUri = uriBuilder.obligationUri(baseUri, documentId, section,
                            annotation.getObligationType());
                    store.add(obligationUri, GraphVocabulary.RDF_TYPE, GraphVocabulary.CLASS_OBLIGATION);
                    store.add(obligationUri, GraphVocabulary.OBLIGATION_TYPE, annotation.getObligationType());
                    store.add(obligationUri, GraphVocabulary.TEXT, annotation.getMatchedText());
                    store.add(obligationUri, GraphVocabulary.PART_OF, articleUri);
                    store.add(articleUri, GraphVocabulary.IMPOSES_OBLIGATION, obligationUri);
                }
            }
        }

        return store.count() - initialCount;
    }

    // ========================= APPLY =========================

    /**
     * Remove every fact touching the target, then every fact touching nodes nested under it
     * through reg:contains or reg:partOf.
     *
     * @return subject facts of the target plus all deleted facts
     */
    int applyRepeal(String targetUri, TripleStore store) {
        int subjectFacts = store.find(targetUri, null, null).size();
        List<String> nested = findNestedUris(targetUri, store);

        int removed = store.delete(targetUri, null, null);
        removed += store.delete(null, null, targetUri);
        for (String nestedUri : nested) {
            removed += store.delete(nestedUri, null, null);
            removed += store.delete(null, null, nestedUri);
        }
        return subjectFacts + removed;
    }

    private List<String> findNestedUris(String targetUri, TripleStore store) {
        List<String> nested = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(targetUri);
        collectNested(targetUri, store, visited, nested);
        return nested;
    }

    private void collectNested(String uri, TripleStore store, Set<String> visited, List<String> nested) {
        for (Triple t : store.find(uri, GraphVocabulary.CONTAINS, null)) {
            if (visited.add(t.getObject())) {
                nested.add(t.getObject());
                collectNested(t.getObject(), store, visited, nested);
            }
        }
        for (Triple t : store.find(null, GraphVocabulary.PART_OF, uri)) {
            if (visited.add(t.getSubject())) {
                nested.add(t.getSubject());
                collectNested(t.getSubject(), store, visited, nested);
            }
        }
    }

    private int applyRedesignation(DiffEntry entry, TripleStore store) {
        String newNumber = entry.getAmendment().getInsertText();
        if (newNumber == null || newNumber.isEmpty()) {
            return 0;
        }
        store.delete(entry.getTargetUri(), GraphVocabulary.NUMBER, null);
        store.add(entry.getTargetUri(), GraphVocabulary.NUMBER, newNumber);
        return 1;
    }

    private TripleStore cloneFor(DiffEntry entry, DraftLibrary library, Map<String, TripleStore> clones,
                                 ScenarioOverlay overlay) {
        String documentId = entry.getTargetDocumentId();
        TripleStore clone = clones.get(documentId);
        if (clone != null) {
            return clone;
        }
        try {
            TripleStore base = library.loadGraph(documentId);
            clone = cloneStore(base);
        } catch (LibraryUnavailableException e) {
            skip(overlay, entry.getAmendment(), "failed to load store: " + e.getMessage());
            return null;
        }
        overlay.getStats().setBaseTriples(overlay.getStats().getBaseTriples() + clone.count());
        clones.put(documentId, clone);
        return clone;
    }

    private void skip(ScenarioOverlay overlay, Amendment amendment, String reason) {
        log.warn("Skipping amendment {}: {}", amendment.getDescription(), reason);
        overlay.getSkippedAmendments().add(new SkippedAmendment(amendment, reason));
    }
}
