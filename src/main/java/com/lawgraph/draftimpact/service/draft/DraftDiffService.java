package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import com.lawgraph.draftimpact.dto.draft.DraftSection;
import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.Triple;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import com.lawgraph.draftimpact.repository.DraftLibraryOpener;
import com.lawgraph.draftimpact.service.graph.ProvisionUriBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a bill's amendments against the regulation graph and classifies each change.
 *
 * An amendment whose target cannot be resolved, or whose document cannot be loaded, is
 * recorded as an unresolved target and the rest of the bill is still processed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DraftDiffService {

    private final DraftLibraryOpener libraryOpener;
    private final ProvisionUriBuilder uriBuilder;

    public DraftDiff computeDiff(DraftBill bill, String libraryPath) {
        if (bill == null) {
            throw new IllegalArgumentException("bill is null");
        }
        return computeDiff(bill, libraryOpener.open(libraryPath));
    }

    /**
     * Compute the diff of a bill against an opened library.
     */
    public DraftDiff computeDiff(DraftBill bill, DraftLibrary library) {
        if (bill == null) {
            throw new IllegalArgumentException("bill is null");
        }
        if (library == null) {
            throw new LibraryUnavailableException("library is null");
        }
        log.info("Computing diff for bill {}", bill.getBillNumber());

        DraftDiff diff = DraftDiff.builder().bill(bill).build();
        GraphSnapshotCache snapshots = new GraphSnapshotCache(library);

        for (DraftSection section : bill.getSections()) {
            for (Amendment amendment : section.getAmendments()) {
                diffAmendment(amendment, library, snapshots, diff);
            }
        }

        log.info("Diff complete: {} added, {} modified, {} removed, {} redesignated, {} unresolved, {} triples invalidated",
                diff.getAdded().size(), diff.getModified().size(), diff.getRemoved().size(),
                diff.getRedesignated().size(), diff.getUnresolvedTargets().size(), diff.getTriplesInvalidated());
        return diff;
    }

    private void diffAmendment(Amendment amendment, DraftLibrary library, GraphSnapshotCache snapshots, DraftDiff diff) {
        String targetUri;
        String documentId;
        TripleStore store;
        try {
            documentId = resolveDocument(amendment, library);
            targetUri = uriBuilder.provisionUri(uriBuilder.normalizeBaseUri(library.getBaseUri()), documentId,
                    amendment.getTargetSection(), amendment.getTargetSubsection());
            store = snapshots.load(documentId);
        } catch (TargetResolutionException | LibraryUnavailableException e) {
            String description = uriBuilder.describeTarget(amendment);
            log.warn("Unresolved amendment target {}: {}", description, e.getMessage());
            diff.getUnresolvedTargets().add(description);
            return;
        }

        int affected = countAffectedTriples(targetUri, store);

        DiffEntry entry = DiffEntry.builder()
                .amendment(amendment)
                .targetUri(targetUri)
                .targetDocumentId(documentId)
                .existingText(store.getOne(targetUri, GraphVocabulary.TEXT))
                .affectedTriples(affected)
                .crossRefsTo(incomingReferences(targetUri, store))
                .crossRefsFrom(outgoingReferences(targetUri, store))
                .build();

        classify(entry, diff);
        diff.setTriplesInvalidated(diff.getTriplesInvalidated() + affected);
    }

    private String resolveDocument(Amendment amendment, DraftLibrary library) throws TargetResolutionException {
        if (amendment.getTargetTitle() == null || amendment.getTargetTitle().isEmpty()) {
            throw new TargetResolutionException("amendment has no target title");
        }
        if (amendment.getTargetSection() == null || amendment.getTargetSection().isEmpty()) {
            throw new TargetResolutionException("amendment has no target section");
        }
        String documentId = uriBuilder.documentId(amendment.getTargetTitle());
        if (library.getDocument(documentId).isEmpty()) {
            throw new TargetResolutionException("document " + documentId + " not found in library");
        }
        return documentId;
    }

    private void classify(DiffEntry entry, DraftDiff diff) {
        Amendment amendment = entry.getAmendment();
        if (amendment.getType() == null) {
            diff.getModified().add(withProposedText(entry));
            return;
        }
        switch (amendment.getType()) {
            case REPEAL -> diff.getRemoved().add(entry);
            case ADD_NEW_SECTION, ADD_AT_END -> diff.getAdded().add(withProposedText(entry));
            case REDESIGNATE -> diff.getRedesignated().add(withProposedText(entry));
            default -> diff.getModified().add(withProposedText(entry));
        }
    }

    private DiffEntry withProposedText(DiffEntry entry) {
        return entry.toBuilder().proposedText(entry.getAmendment().getInsertText()).build();
    }

    /**
     * Facts with the target as subject plus facts with it as object. A self-referencing fact
     * is counted twice.
     */
    static int countAffectedTriples(String targetUri, TripleStore store) {
        return store.find(targetUri, null, null).size() + store.find(null, null, targetUri).size();
    }

    static List<String> incomingReferences(String targetUri, TripleStore store) {
        Set<String> incoming = new LinkedHashSet<>();
        for (Triple t : store.find(null, GraphVocabulary.REFERENCES, targetUri)) {
            incoming.add(t.getSubject());
        }
        for (Triple t : store.find(targetUri, GraphVocabulary.REFERENCED_BY, null)) {
            incoming.add(t.getObject());
        }
        return new ArrayList<>(incoming);
    }

    static List<String> outgoingReferences(String targetUri, TripleStore store) {
        Set<String> outgoing = new LinkedHashSet<>();
        for (Triple t : store.find(targetUri, GraphVocabulary.REFERENCES, null)) {
            outgoing.add(t.getObject());
        }
        for (Triple t : store.find(null, GraphVocabulary.REFERENCED_BY, targetUri)) {
            outgoing.add(t.getSubject());
        }
        return new ArrayList<>(outgoing);
    }
}
