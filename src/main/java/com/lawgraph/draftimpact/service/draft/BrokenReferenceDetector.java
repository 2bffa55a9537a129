package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.dto.diff.DiffEntry;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import com.lawgraph.draftimpact.dto.finding.BrokenReference;
import com.lawgraph.draftimpact.dto.finding.Finding;
import com.lawgraph.draftimpact.dto.finding.Severity;
import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds cross-references a bill invalidates.
 *
 * References into repealed or redesignated provisions are errors: the target no longer exists
 * under its old identity. References into modified provisions take their severity from the
 * kind of modification.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BrokenReferenceDetector {

    private final DraftLibraryOpener libraryOpener;

    public List<BrokenReference> detectBrokenReferences(DraftDiff diff, String libraryPath) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        return detectBrokenReferences(diff, libraryOpener.open(libraryPath));
    }

    public List<BrokenReference> detectBrokenReferences(DraftDiff diff, DraftLibrary library) {
        if (diff == null) {
            throw new IllegalArgumentException("diff is null");
        }
        if (library == null) {
            throw new LibraryUnavailableException("library is null");
        }

        GraphSnapshotCache snapshots = new GraphSnapshotCache(library);
        List<BrokenReference> broken = new ArrayList<>();

        for (DiffEntry entry : diff.getRemoved()) {
            snapshots.tryLoad(entry.getTargetDocumentId()).ifPresent(store ->
                    broken.addAll(findIncomingReferences(entry, store, Severity.ERROR, "target repealed")));
        }
        for (DiffEntry entry : diff.getModified()) {
            Amendment amendment = entry.getAmendment();
            snapshots.tryLoad(entry.getTargetDocumentId()).ifPresent(store ->
                    broken.addAll(findIncomingReferences(entry, store,
                            classifyBreakSeverity(amendment), reasonPrefix(amendment))));
        }
        for (DiffEntry entry : diff.getRedesignated()) {
            snapshots.tryLoad(entry.getTargetDocumentId()).ifPresent(store ->
                    broken.addAll(findIncomingReferences(entry, store, Severity.ERROR, "target redesignated")));
        }

        broken.sort(Finding.ORDER);
        log.info("Detected {} broken cross-references", broken.size());
        return broken;
    }

    /**
     * Severity a change of this kind implies for references into the changed provision.
     */
    public static Severity classifyBreakSeverity(Amendment amendment) {
        if (amendment == null || amendment.getType() == null) {
            return Severity.WARNING;
        }
        return switch (amendment.getType()) {
            case REPEAL, REDESIGNATE -> Severity.ERROR;
            case STRIKE_INSERT -> Severity.WARNING;
            case ADD_AT_END, ADD_NEW_SECTION, TABLE_OF_CONTENTS -> Severity.INFO;
        };
    }

    static String reasonPrefix(Amendment amendment) {
        if (amendment == null || amendment.getType() == null) {
            return "target modified";
        }
        return switch (amendment.getType()) {
            case REPEAL -> "target repealed";
            case REDESIGNATE -> "target redesignated";
            case STRIKE_INSERT -> "target substantially modified";
            case ADD_AT_END -> "target extended";
            case ADD_NEW_SECTION -> "target section added";
            case TABLE_OF_CONTENTS -> "target table of contents updated";
        };
    }

    private List<BrokenReference> findIncomingReferences(DiffEntry entry, TripleStore store,
                                                         Severity severity, String reasonPrefix) {
        String targetUri = entry.getTargetUri();
        String targetLabel = ProvisionLabels.uriLabel(targetUri);
        String reason = String.format("%s §%s", reasonPrefix, targetLabel);
        Set<String> seenSources = new HashSet<>();
        List<BrokenReference> refs = new ArrayList<>();

        for (Triple t : store.find(null, GraphVocabulary.REFERENCES, targetUri)) {
            addReference(t.getSubject(), GraphVocabulary.REFERENCES, entry, store, severity, reason, seenSources, refs);
        }
        for (Triple t : store.find(targetUri, GraphVocabulary.REFERENCED_BY, null)) {
            addReference(t.getObject(), GraphVocabulary.REFERENCES, entry, store, severity, reason, seenSources, refs);
        }
        for (String predicate : GraphVocabulary.TYPED_REFERENCE_PREDICATES) {
            for (Triple t : store.find(null, predicate, targetUri)) {
                addReference(t.getSubject(), predicate, entry, store, severity, reason, seenSources, refs);
            }
        }
        return refs;
    }

    private void addReference(String sourceUri, String predicate, DiffEntry entry, TripleStore store,
                              Severity severity, String reason, Set<String> seenSources, List<BrokenReference> refs) {
        if (!seenSources.add(sourceUri)) {
            return;
        }
        refs.add(BrokenReference.builder()
                .sourceUri(sourceUri)
                .sourceLabel(ProvisionLabels.displayLabel(store, sourceUri))
                .sourceDocumentId(entry.getTargetDocumentId())
                .targetUri(entry.getTargetUri())
                .targetLabel(ProvisionLabels.uriLabel(entry.getTargetUri()))
                .severity(severity)
                .predicate(predicate)
                .reason(reason)
                .build());
    }
}
