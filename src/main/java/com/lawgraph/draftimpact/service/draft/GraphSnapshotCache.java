package com.lawgraph.draftimpact.service.draft;

import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import com.lawgraph.draftimpact.repository.DraftLibrary;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Document graphs loaded during one analysis call, keyed by document id.
 * Never shared between calls.
 */
@Slf4j
class GraphSnapshotCache {

    private final DraftLibrary library;
    private final Map<String, TripleStore> snapshots = new HashMap<>();

    GraphSnapshotCache(DraftLibrary library) {
        this.library = library;
    }

    /**
     * @throws LibraryUnavailableException if the document cannot be loaded
     */
    TripleStore load(String documentId) {
        TripleStore cached = snapshots.get(documentId);
        if (cached != null) {
            return cached;
        }
        TripleStore loaded = library.loadGraph(documentId);
        snapshots.put(documentId, loaded);
        return loaded;
    }

    /**
     * Load, or log and return empty so the caller can skip this entry.
     */
    Optional<TripleStore> tryLoad(String documentId) {
        try {
            return Optional.of(load(documentId));
        } catch (LibraryUnavailableException e) {
            log.warn("Skipping entry, could not load graph for {}: {}", documentId, e.getMessage());
            return Optional.empty();
        }
    }
}
