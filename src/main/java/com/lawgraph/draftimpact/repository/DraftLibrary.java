package com.lawgraph.draftimpact.repository;

import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.TripleStore;

import java.util.Optional;

/**
 * An opened regulation library. Analysis code treats every store it returns as read-only.
 */
public interface DraftLibrary {

    /**
     * Load the graph snapshot of one document.
     *
     * @throws LibraryUnavailableException if the document's graph cannot be loaded
     */
    TripleStore loadGraph(String documentId);

    Optional<DocumentEntry> getDocument(String documentId);

    /**
     * @return the base URI node identifiers were minted under, or an empty string if unknown
     */
    String getBaseUri();
}
