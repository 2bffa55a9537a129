package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.graph.TraversalDirection;
import com.lawgraph.draftimpact.dto.graph.TraversalNode;
import com.lawgraph.draftimpact.dto.graph.TraversalResult;
import com.lawgraph.draftimpact.dto.impact.AffectedProvision;
import com.lawgraph.draftimpact.dto.impact.DraftImpactResult;
import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.Triple;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.DraftLibraryOpener;
import com.lawgraph.draftimpact.service.graph.ProvisionLabels;
import com.lawgraph.draftimpact.service.graph.ReferenceTraversalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes which provisions a bill reaches through cross-references.
 *
 * Modified and repealed provisions are traversed in both reference directions up to the
 * requested depth. Classification is global and first-come: once a provision has been listed
 * as directly or transitively affected it is not listed again, whichever later traversal
 * reaches it. Added provisions contribute only their obligations and rights.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DraftImpactService {

    private final DraftLibraryOpener libraryOpener;
    private final ReferenceTraversalService traversalService;
    private final BrokenReferenceDetector brokenReferenceDetector;

    public DraftImpactResult analyzeImpact(DraftDiff diff, String libraryPath, int depth) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        return analyzeImpact(diff, libraryOpener.open(libraryPath), depth);
    }

    public DraftImpactResult analyzeImpact(DraftDiff diff, DraftLibrary library, int depth) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        if (library == null) {
            throw new LibraryUnavailableException("library is null");
        }
        int maxDepth = Math.max(depth, 1);
        log.info("Analyzing impact of {} modified and {} repealed provisions to depth {}",
                diff.getModified().size(), diff.getRemoved().size(), maxDepth);

        DraftImpactResult result = DraftImpactResult.builder().diff(diff).build();
        GraphSnapshotCache snapshots = new GraphSnapshotCache(library);
        Set<String> classified = new HashSet<>();

        for (DiffEntry entry : diff.getModified()) {
            snapshots.tryLoad(entry.getTargetDocumentId()).ifPresent(store -> {
                analyzeEntry(entry, store, maxDepth, "modified", result, classified);
                collectObligationsAndRights(entry.getTargetUri(), store,
                        result.getObligationChanges().getModified(), result.getRightsChanges().getModified());
            });
        }

        for (DiffEntry entry : diff.getRemoved()) {
            snapshots.tryLoad(entry.getTargetDocumentId()).ifPresent(store -> {
                analyzeEntry(entry, store, maxDepth, "repealed", result, classified);
                collectObligationsAndRights(entry.getTargetUri(), store,
                        result.getObligationChanges().getRemoved(), result.getRightsChanges().getRemoved());
            });
        }

        for (DiffEntry entry : diff.getAdded()) {
            snapshots.tryLoad(entry.getTargetDocumentId()).ifPresent(store ->
                    collectObligationsAndRights(entry.getTargetUri(), store,
                            result.getObligationChanges().getAdded(), result.getRightsChanges().getAdded()));
        }

        result.setBrokenCrossRefs(brokenReferenceDetector.detectBrokenReferences(diff, library));
        finish(result);

        log.info("Impact analysis complete: {} direct, {} transitive, {} broken references, max depth {}",
                result.getDirectlyAffected().size(), result.getTransitivelyAffected().size(),
                result.getBrokenCrossRefs().size(), result.getMaxDepthReached());
        return result;
    }

    /**
     * Merge independently computed traversals with the same first-wins classification.
     */
    public DraftImpactResult aggregate(List<TraversalResult> traversals) {
        DraftImpactResult aggregated = new DraftImpactResult();
        Set<String> classified = new HashSet<>();

        for (TraversalResult traversal : traversals) {
            if (traversal == null) {
                continue;
            }
            String targetLabel = ProvisionLabels.uriLabel(traversal.getTargetUri());
            for (TraversalNode node : traversal.getDirectIncoming()) {
                if (classified.add(node.getUri())) {
                    aggregated.getDirectlyAffected().add(AffectedProvision.builder()
                            .uri(node.getUri())
                            .label(node.getLabel())
                            .depth(node.getDepth())
                            .reason("references " + targetLabel)
                            .build());
                }
            }
            for (TraversalNode node : traversal.getTransitive()) {
                if (classified.add(node.getUri())) {
                    aggregated.getTransitivelyAffected().add(AffectedProvision.builder()
                            .uri(node.getUri())
                            .label(node.getLabel())
                            .depth(node.getDepth())
                            .reason("transitively linked via " + targetLabel)
                            .build());
                }
            }
        }

        finish(aggregated);
        return aggregated;
    }

    private void analyzeEntry(DiffEntry entry, TripleStore store, int maxDepth, String changeKind,
                              DraftImpactResult result, Set<String> classified) {
        TraversalResult traversal = traversalService.traverse(store, entry.getTargetUri(), maxDepth,
                TraversalDirection.BOTH);
        String targetLabel = ProvisionLabels.uriLabel(entry.getTargetUri());

        for (TraversalNode node : traversal.getDirectIncoming()) {
            if (classified.add(node.getUri())) {
                result.getDirectlyAffected().add(AffectedProvision.builder()
                        .uri(node.getUri())
                        .label(node.getLabel())
                        .documentId(entry.getTargetDocumentId())
                        .depth(1)
                        .reason(String.format("references %s %s", changeKind, targetLabel))
                        .build());
            }
        }

        for (TraversalNode node : traversal.getTransitive()) {
            if (classified.add(node.getUri())) {
                result.getTransitivelyAffected().add(AffectedProvision.builder()
                        .uri(node.getUri())
                        .label(node.getLabel())
                        .documentId(entry.getTargetDocumentId())
                        .depth(node.getDepth())
                        .reason(String.format("transitively linked via %s %s", changeKind, targetLabel))
                        .build());
            }
        }
    }

    private void collectObligationsAndRights(String targetUri, TripleStore store,
                                             List<String> obligations, List<String> rights) {
        for (Triple t : store.find(targetUri, GraphVocabulary.IMPOSES_OBLIGATION, null)) {
            obligations.add(t.getObject());
        }
        for (Triple t : store.find(targetUri, GraphVocabulary.GRANTS_RIGHT, null)) {
            rights.add(t.getObject());
        }
    }

    private void finish(DraftImpactResult result) {
        result.setTotalProvisionsAffected(result.getDirectlyAffected().size() + result.getTransitivelyAffected().size());
        int maxDepth = 0;
        for (AffectedProvision provision : result.getDirectlyAffected()) {
            maxDepth = Math.max(maxDepth, provision.getDepth());
        }
        for (AffectedProvision provision : result.getTransitivelyAffected()) {
            maxDepth = Math.max(maxDepth, provision.getDepth());
        }
        result.setMaxDepthReached(maxDepth);
    }
}
